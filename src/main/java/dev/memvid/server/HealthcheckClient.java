package dev.memvid.server;

import dev.memvid.proto.v1.HealthGrpc;
import dev.memvid.proto.v1.MemvidProto.HealthCheckRequest;
import dev.memvid.proto.v1.MemvidProto.HealthCheckResponse;
import io.grpc.ManagedChannel;
import io.grpc.StatusRuntimeException;
import io.grpc.netty.shaded.io.grpc.netty.NettyChannelBuilder;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot container healthcheck: calls {@code Health/Check} and reports whether the gateway is
 * serving.
 *
 * <p>With {@code GRPC_URL} set only that target is tried. Otherwise the IPv6 then the IPv4
 * loopback are tried on {@code GRPC_PORT}.
 */
public final class HealthcheckClient {

  private static final Logger log = LoggerFactory.getLogger(HealthcheckClient.class);

  /** First program argument selecting healthcheck mode. */
  public static final String COMMAND = "healthcheck";

  static final Duration EXPLICIT_TARGET_DEADLINE = Duration.ofSeconds(5);
  static final Duration LOOPBACK_DEADLINE = Duration.ofSeconds(2);
  static final int DEFAULT_PORT = 50051;

  private final @Nullable String grpcUrl;
  private final int port;

  public HealthcheckClient(@Nullable String grpcUrl, int port) {
    this.grpcUrl = grpcUrl == null || grpcUrl.isBlank() ? null : grpcUrl;
    this.port = port;
  }

  /** Client configured from {@code GRPC_URL} and {@code GRPC_PORT}. */
  public static HealthcheckClient fromEnvironment(Map<String, String> environment) {
    int port = DEFAULT_PORT;
    String configuredPort = environment.get("GRPC_PORT");
    if (configuredPort != null) {
      try {
        port = Integer.parseInt(configuredPort.trim());
      } catch (NumberFormatException e) {
        log.warn("Ignoring invalid GRPC_PORT '{}', using {}", configuredPort, DEFAULT_PORT);
      }
    }
    return new HealthcheckClient(environment.get("GRPC_URL"), port);
  }

  /** Runs the check and returns the process exit status: 0 when serving, 1 otherwise. */
  public int run() {
    if (grpcUrl != null) {
      if (isServing(toTarget(grpcUrl), EXPLICIT_TARGET_DEADLINE)) {
        log.info("healthcheck: gRPC service is healthy");
        return 0;
      }
      log.error("healthcheck: gRPC health check failed for {}", grpcUrl);
      return 1;
    }
    for (String target : List.of("[::1]:" + port, "127.0.0.1:" + port)) {
      if (isServing(target, LOOPBACK_DEADLINE)) {
        log.info("healthcheck: gRPC service is healthy (via {})", target);
        return 0;
      }
    }
    log.error("healthcheck: failed to connect via IPv4 or IPv6");
    return 1;
  }

  static boolean isServing(String target, Duration deadline) {
    ManagedChannel channel = NettyChannelBuilder.forTarget(target).usePlaintext().build();
    try {
      HealthCheckResponse response =
          HealthGrpc.newBlockingStub(channel)
              .withDeadlineAfter(deadline.toMillis(), TimeUnit.MILLISECONDS)
              .check(HealthCheckRequest.getDefaultInstance());
      return response.getStatus() == HealthCheckResponse.Status.SERVING;
    } catch (StatusRuntimeException e) {
      log.debug("Health check against {} failed: {}", target, e.getStatus());
      return false;
    } finally {
      channel.shutdownNow();
    }
  }

  /** Strips an {@code http://} or {@code https://} scheme and a trailing slash. */
  static String toTarget(String url) {
    String target = url;
    if (target.startsWith("http://")) {
      target = target.substring("http://".length());
    } else if (target.startsWith("https://")) {
      target = target.substring("https://".length());
    }
    return target.endsWith("/") ? target.substring(0, target.length() - 1) : target;
  }
}

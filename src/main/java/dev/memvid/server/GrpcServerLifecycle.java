package dev.memvid.server;

import dev.memvid.config.MemvidProperties;
import io.grpc.BindableService;
import io.grpc.Server;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Runs the Netty gRPC server for every {@link BindableService} bean, started after the backend is
 * ready and stopped with the application context.
 */
@Component
public class GrpcServerLifecycle implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(GrpcServerLifecycle.class);

  static final long SHUTDOWN_GRACE_SECONDS = 5;

  private final List<BindableService> services;
  private final MemvidProperties properties;
  private final BindAddressResolver resolver;
  private volatile @Nullable Server server;

  @Autowired
  public GrpcServerLifecycle(List<BindableService> services, MemvidProperties properties) {
    this(services, properties, new BindAddressResolver());
  }

  GrpcServerLifecycle(
      List<BindableService> services, MemvidProperties properties, BindAddressResolver resolver) {
    this.services = List.copyOf(services);
    this.properties = properties;
    this.resolver = resolver;
  }

  @Override
  public void start() {
    ResolvedBindAddress address =
        resolver.resolve(properties.getBindAddress(), properties.getGrpcPort());
    NettyServerBuilder builder = NettyServerBuilder.forAddress(address.socketAddress());
    services.forEach(builder::addService);
    try {
      server = builder.build().start();
    } catch (IOException e) {
      throw new IllegalStateException("Failed to start gRPC server on " + address, e);
    }
    log.info("gRPC server listening on {} with {} services", address, services.size());
  }

  @Override
  public void stop() {
    Server running = server;
    if (running == null) {
      return;
    }
    log.info("Stopping gRPC server");
    running.shutdown();
    try {
      if (!running.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
        log.warn("gRPC server did not stop within {}s, forcing shutdown", SHUTDOWN_GRACE_SECONDS);
        running.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      running.shutdownNow();
    } finally {
      server = null;
    }
  }

  @Override
  public boolean isRunning() {
    return server != null;
  }

  /** Actual listen port, useful when the configured port is 0. */
  public int getPort() {
    Server running = server;
    if (running == null) {
      throw new IllegalStateException("gRPC server is not running");
    }
    return running.getPort();
  }
}

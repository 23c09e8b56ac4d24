package dev.memvid.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the configured bind address into the address the gRPC server listens on.
 *
 * <ul>
 *   <li>an explicit address is used verbatim, IPv6 literals gain brackets
 *   <li>{@value #AUTO} probes the dual-stack wildcard {@code [::]} once and falls back to {@code
 *       0.0.0.0} when it cannot be bound
 * </ul>
 */
public class BindAddressResolver {

  private static final Logger log = LoggerFactory.getLogger(BindAddressResolver.class);

  public static final String AUTO = "auto";
  static final String DUAL_STACK_HOST = "[::]";
  static final String IPV4_HOST = "0.0.0.0";

  private final PortProbe probe;

  public BindAddressResolver() {
    this(BindAddressResolver::probeWithServerSocket);
  }

  public BindAddressResolver(PortProbe probe) {
    this.probe = probe;
  }

  public ResolvedBindAddress resolve(String bindAddress, int port) {
    if (!AUTO.equals(bindAddress)) {
      String host =
          bindAddress.contains(":") && !bindAddress.startsWith("[")
              ? "[" + bindAddress + "]"
              : bindAddress;
      log.info("Using configured bind address {}:{}", host, port);
      return new ResolvedBindAddress(host, port);
    }

    ResolvedBindAddress dualStack = new ResolvedBindAddress(DUAL_STACK_HOST, port);
    if (probe.canBind(dualStack.socketAddress())) {
      log.info("Auto-detected dual-stack support, using {}", dualStack);
      return dualStack;
    }
    log.info("IPv6 not available, falling back to IPv4 ({})", IPV4_HOST);
    return new ResolvedBindAddress(IPV4_HOST, port);
  }

  static boolean probeWithServerSocket(InetSocketAddress address) {
    try (ServerSocket socket = new ServerSocket()) {
      socket.bind(address);
      return true;
    } catch (IOException e) {
      log.debug("Probe bind of {} failed: {}", address, e.getMessage());
      return false;
    }
  }
}

package dev.memvid.server;

import java.net.InetSocketAddress;

/**
 * Address the gRPC server listens on.
 *
 * @param host host as written in logs, IPv6 literals bracketed
 * @param port listen port
 */
public record ResolvedBindAddress(String host, int port) {

  /** Socket address for the server builder, with IPv6 brackets removed. */
  public InetSocketAddress socketAddress() {
    String literal =
        host.startsWith("[") && host.endsWith("]") ? host.substring(1, host.length() - 1) : host;
    return new InetSocketAddress(literal, port);
  }

  @Override
  public String toString() {
    return host + ":" + port;
  }
}

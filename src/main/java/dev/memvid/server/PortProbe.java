package dev.memvid.server;

import java.net.InetSocketAddress;

/** Checks whether a listening socket can be bound on an address. */
@FunctionalInterface
public interface PortProbe {

  /**
   * Attempts to bind the address once and releases it immediately.
   *
   * @return true when the bind succeeded
   */
  boolean canBind(InetSocketAddress address);
}

package dev.memvid;

import dev.memvid.server.HealthcheckClient;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the memvid gRPC gateway.
 *
 * <p>Started with {@code healthcheck} as first argument, it probes a running gateway and exits
 * instead of starting one.
 */
@SpringBootApplication
public class MemvidGatewayApplication {
  public static void main(String[] args) {
    if (args.length > 0 && HealthcheckClient.COMMAND.equals(args[0])) {
      System.exit(HealthcheckClient.fromEnvironment(System.getenv()).run());
    }
    SpringApplication.run(MemvidGatewayApplication.class, args);
  }
}

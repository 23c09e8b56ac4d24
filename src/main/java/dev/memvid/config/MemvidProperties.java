package dev.memvid.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised gateway configuration, bound from {@code memvid.*} in application.yml.
 *
 * <ul>
 *   <li>{@code file-path} - index file to open when not in mock mode (env {@code
 *       MEMVID_FILE_PATH}, default {@code data/.memvid/resume.mv2})
 *   <li>{@code grpc-port} - gRPC listen port (env {@code GRPC_PORT}, default 50051)
 *   <li>{@code bind-address} - gRPC bind address or {@code auto} (env {@code BIND_ADDRESS})
 *   <li>{@code mock} - serve the deterministic sample dataset (env {@code MOCK_MEMVID})
 *   <li>{@code blocking-threads} - size of the executor running index calls (env {@code
 *       MEMVID_BLOCKING_THREADS}, default 4)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "memvid")
public class MemvidProperties {

  private String filePath = "data/.memvid/resume.mv2";
  private int grpcPort = 50051;
  private String bindAddress = "auto";
  private boolean mock;
  private int blockingThreads = 4;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (grpcPort < 0 || grpcPort > 65535) {
      throw new IllegalStateException("memvid.grpc-port must be in [0, 65535], got: " + grpcPort);
    }
    if (blockingThreads < 1) {
      throw new IllegalStateException(
          "memvid.blocking-threads must be at least 1, got: " + blockingThreads);
    }
    if (bindAddress == null || bindAddress.isBlank()) {
      throw new IllegalStateException("memvid.bind-address must not be blank");
    }
    if (!mock && (filePath == null || filePath.isBlank())) {
      throw new IllegalStateException(
          "memvid.file-path (MEMVID_FILE_PATH) is required unless memvid.mock is enabled");
    }
  }

  public String getFilePath() {
    return filePath;
  }

  public void setFilePath(String filePath) {
    this.filePath = filePath;
  }

  public int getGrpcPort() {
    return grpcPort;
  }

  public void setGrpcPort(int grpcPort) {
    this.grpcPort = grpcPort;
  }

  public String getBindAddress() {
    return bindAddress;
  }

  public void setBindAddress(String bindAddress) {
    this.bindAddress = bindAddress;
  }

  public boolean isMock() {
    return mock;
  }

  public void setMock(boolean mock) {
    this.mock = mock;
  }

  public int getBlockingThreads() {
    return blockingThreads;
  }

  public void setBlockingThreads(int blockingThreads) {
    this.blockingThreads = blockingThreads;
  }
}

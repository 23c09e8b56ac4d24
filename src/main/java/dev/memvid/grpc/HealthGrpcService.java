package dev.memvid.grpc;

import dev.memvid.proto.v1.HealthGrpc;
import dev.memvid.proto.v1.MemvidProto.HealthCheckRequest;
import dev.memvid.proto.v1.MemvidProto.HealthCheckResponse;
import dev.memvid.searcher.Searcher;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Reports backend readiness, frame count and data source on {@code Health/Check}. */
@Component
public class HealthGrpcService extends HealthGrpc.HealthImplBase {

  private static final Logger log = LoggerFactory.getLogger(HealthGrpcService.class);

  private final Searcher searcher;

  public HealthGrpcService(Searcher searcher) {
    this.searcher = searcher;
  }

  @Override
  public void check(
      HealthCheckRequest request, StreamObserver<HealthCheckResponse> responseObserver) {
    boolean ready = searcher.isReady();
    log.debug("Health check: ready={}", ready);

    responseObserver.onNext(
        HealthCheckResponse.newBuilder()
            .setStatus(
                ready
                    ? HealthCheckResponse.Status.SERVING
                    : HealthCheckResponse.Status.NOT_SERVING)
            .setFrameCount(searcher.frameCount())
            .setMemvidFile(searcher.memvidFile())
            .build());
    responseObserver.onCompleted();
  }
}

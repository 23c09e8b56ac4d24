package dev.memvid.grpc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import dev.memvid.proto.v1.HealthGrpc;
import dev.memvid.proto.v1.MemvidProto.HealthCheckRequest;
import dev.memvid.proto.v1.MemvidProto.HealthCheckResponse;
import dev.memvid.searcher.Searcher;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import java.io.IOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class HealthGrpcServiceTest {

  @Mock Searcher searcher;

  Server server;
  ManagedChannel channel;
  HealthGrpc.HealthBlockingStub stub;

  @BeforeEach
  void setUp() throws IOException {
    String name = InProcessServerBuilder.generateName();
    server =
        InProcessServerBuilder.forName(name)
            .directExecutor()
            .addService(new HealthGrpcService(searcher))
            .build()
            .start();
    channel = InProcessChannelBuilder.forName(name).directExecutor().build();
    stub = HealthGrpc.newBlockingStub(channel);
  }

  @AfterEach
  void tearDown() {
    channel.shutdownNow();
    server.shutdownNow();
  }

  @Test
  void ready_backend_is_serving() {
    when(searcher.isReady()).thenReturn(true);
    when(searcher.frameCount()).thenReturn(42);
    when(searcher.memvidFile()).thenReturn("/data/resume.mv2");

    HealthCheckResponse response = stub.check(HealthCheckRequest.getDefaultInstance());

    assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.SERVING);
    assertThat(response.getFrameCount()).isEqualTo(42);
    assertThat(response.getMemvidFile()).isEqualTo("/data/resume.mv2");
  }

  @Test
  void busy_backend_is_not_serving() {
    when(searcher.isReady()).thenReturn(false);
    when(searcher.frameCount()).thenReturn(7);
    when(searcher.memvidFile()).thenReturn("/data/resume.mv2");

    HealthCheckResponse response =
        stub.check(HealthCheckRequest.newBuilder().setService("memvid").build());

    assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.NOT_SERVING);
    assertThat(response.getFrameCount()).isEqualTo(7);
  }
}

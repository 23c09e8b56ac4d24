package dev.memvid.grpc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.memvid.metrics.SearchMetrics;
import dev.memvid.proto.v1.MemvidProto;
import dev.memvid.proto.v1.MemvidServiceGrpc;
import dev.memvid.searcher.AskMode;
import dev.memvid.searcher.AskRequest;
import dev.memvid.searcher.MockSearcher;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MemvidGrpcServiceTest {

  SimpleMeterRegistry registry;
  Server server;
  ManagedChannel channel;
  MemvidServiceGrpc.MemvidServiceBlockingStub stub;

  @BeforeEach
  void setUp() throws IOException {
    registry = new SimpleMeterRegistry();
    String name = InProcessServerBuilder.generateName();
    server =
        InProcessServerBuilder.forName(name)
            .directExecutor()
            .addService(new MemvidGrpcService(new MockSearcher(), new SearchMetrics(registry)))
            .build()
            .start();
    channel = InProcessChannelBuilder.forName(name).directExecutor().build();
    stub = MemvidServiceGrpc.newBlockingStub(channel);
  }

  @AfterEach
  void tearDown() {
    channel.shutdownNow();
    server.shutdownNow();
  }

  // --- Search ---

  @Test
  void search_substitutes_defaults_for_zero_values() {
    MemvidProto.SearchResponse response =
        stub.search(MemvidProto.SearchRequest.newBuilder().setQuery("leadership").build());

    assertThat(response.getHitsCount()).isEqualTo(MemvidGrpcService.DEFAULT_TOP_K);
    assertThat(response.getTotalHits()).isEqualTo(5);
    assertThat(response.getHits(0).getTitle())
        .isEqualTo("Senior Engineering Manager at Northwind Systems");
    assertThat(response.getHits(0).getTagsList()).contains("leadership");
    assertThat(response.getHitsList())
        .allSatisfy(hit -> assertThat(hit.getSnippet().length()).isLessThanOrEqualTo(200));
  }

  @Test
  void search_records_latency_and_count() {
    stub.search(MemvidProto.SearchRequest.newBuilder().setQuery("java").setTopK(2).build());
    stub.search(MemvidProto.SearchRequest.newBuilder().setQuery("java").setTopK(2).build());

    assertThat(registry.get("memvid.search").counter().count()).isEqualTo(2.0);
    assertThat(registry.get("memvid.search.latency.ms").summary().count()).isEqualTo(2);
    assertThat(registry.get("memvid.search.errors").counter().count()).isZero();
  }

  @Test
  void empty_query_is_invalid_argument_and_counted_as_error() {
    assertThatThrownBy(() -> stub.search(MemvidProto.SearchRequest.getDefaultInstance()))
        .isInstanceOfSatisfying(
            StatusRuntimeException.class,
            e -> {
              assertThat(e.getStatus().getCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
              assertThat(e.getStatus().getDescription())
                  .isEqualTo("Invalid request: Query cannot be empty");
            });
    assertThat(registry.get("memvid.search.errors").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("memvid.search").counter().count()).isZero();
  }

  // --- Ask ---

  @Test
  void ask_returns_evidence_answer_and_stats() {
    MemvidProto.AskResponse response =
        stub.ask(
            MemvidProto.AskRequest.newBuilder()
                .setQuestion("security")
                .setTopK(1)
                .putFilters("area", "security")
                .build());

    assertThat(response.getEvidenceCount()).isEqualTo(1);
    assertThat(response.getAnswer()).startsWith("**Security Engineering Background**\n");
    assertThat(response.getStats().getResultsReturned()).isEqualTo(1);
    assertThat(response.getStats().getUsedFallback()).isFalse();
  }

  @Test
  void ask_with_empty_question_is_invalid_argument() {
    assertThatThrownBy(() -> stub.ask(MemvidProto.AskRequest.getDefaultInstance()))
        .isInstanceOfSatisfying(
            StatusRuntimeException.class,
            e ->
                assertThat(e.getStatus().getDescription())
                    .isEqualTo("Invalid request: Question cannot be empty"));
  }

  @Test
  void ask_request_translation_keeps_optional_presence() {
    AskRequest request =
        MemvidGrpcService.toAskRequest(
            MemvidProto.AskRequest.newBuilder()
                .setQuestion("q")
                .setUseLlm(true)
                .setStart(100)
                .setEnd(200)
                .setModeValue(MemvidProto.AskMode.ASK_MODE_SEM_VALUE)
                .setAsOfFrame(0)
                .setAdaptive(false)
                .build());

    assertThat(request.useLlm()).isTrue();
    assertThat(request.topK()).isEqualTo(MemvidGrpcService.DEFAULT_TOP_K);
    assertThat(request.snippetChars()).isEqualTo(MemvidGrpcService.DEFAULT_SNIPPET_CHARS);
    assertThat(request.start()).isEqualTo(100);
    assertThat(request.end()).isEqualTo(200);
    assertThat(request.mode()).isEqualTo(AskMode.SEMANTIC);
    // explicitly set zero and false stay present
    assertThat(request.asOfFrame()).isZero();
    assertThat(request.adaptive()).isFalse();
    assertThat(request.asOfTs()).isNull();
    assertThat(request.uri()).isNull();
    assertThat(request.cursor()).isNull();
  }

  @Test
  void unrecognized_mode_falls_back_to_hybrid() {
    assertThat(MemvidGrpcService.toAskMode(0)).isEqualTo(AskMode.HYBRID);
    assertThat(MemvidGrpcService.toAskMode(1)).isEqualTo(AskMode.SEMANTIC);
    assertThat(MemvidGrpcService.toAskMode(2)).isEqualTo(AskMode.LEXICAL);
    assertThat(MemvidGrpcService.toAskMode(99)).isEqualTo(AskMode.HYBRID);
  }

  @Test
  void ask_accepts_unknown_wire_mode() {
    MemvidProto.AskResponse response =
        stub.ask(MemvidProto.AskRequest.newBuilder().setQuestion("java").setModeValue(42).build());

    assertThat(response.getEvidenceCount()).isPositive();
  }

  // --- GetState ---

  @Test
  void get_state_with_empty_slot_returns_all_slots() {
    MemvidProto.GetStateResponse response =
        stub.getState(
            MemvidProto.GetStateRequest.newBuilder()
                .setEntity(MockSearcher.PROFILE_ENTITY)
                .build());

    assertThat(response.getFound()).isTrue();
    assertThat(response.getEntity()).isEqualTo(MockSearcher.PROFILE_ENTITY);
    assertThat(response.getSlotsMap()).containsKey(MockSearcher.PROFILE_SLOT);
  }

  @Test
  void get_state_for_unknown_entity_is_not_found_response() {
    MemvidProto.GetStateResponse response =
        stub.getState(MemvidProto.GetStateRequest.newBuilder().setEntity("nobody").build());

    assertThat(response.getFound()).isFalse();
    assertThat(response.getSlotsMap()).isEmpty();
  }
}

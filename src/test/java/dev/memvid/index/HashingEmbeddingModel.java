package dev.memvid.index;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/** Deterministic bag-of-words embedding: each token hashed into one of 512 dimensions. */
class HashingEmbeddingModel implements EmbeddingModel {

  static final int DIMENSION = 512;

  final AtomicInteger embeddedTexts = new AtomicInteger();

  @Override
  public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
    embeddedTexts.addAndGet(segments.size());
    return Response.from(segments.stream().map(segment -> hashEmbed(segment.text())).toList());
  }

  @Override
  public int dimension() {
    return DIMENSION;
  }

  private static Embedding hashEmbed(String text) {
    float[] vector = new float[DIMENSION];
    for (String token : LexicalScorer.tokenize(text)) {
      vector[Math.floorMod(token.hashCode(), DIMENSION)] += 1.0f;
    }
    Embedding embedding = Embedding.from(vector);
    embedding.normalize();
    return embedding;
  }
}

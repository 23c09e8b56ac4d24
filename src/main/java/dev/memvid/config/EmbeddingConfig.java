package dev.memvid.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.memvid.index.EmbeddingMemvidIndex;
import dev.memvid.index.MemvidIndexLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Embedding model and index loader for the real backend.
 *
 * <p>Both beans are lazy so that mock mode never loads the ONNX model.
 */
@Configuration
public class EmbeddingConfig {

  /** In-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions). */
  @Bean
  @Lazy
  public EmbeddingModel embeddingModel() {
    return new BgeSmallEnV15QuantizedEmbeddingModel();
  }

  @Bean
  @Lazy
  public MemvidIndexLoader memvidIndexLoader(
      EmbeddingModel embeddingModel, ObjectMapper objectMapper) {
    return EmbeddingMemvidIndex.loader(embeddingModel, objectMapper);
  }
}

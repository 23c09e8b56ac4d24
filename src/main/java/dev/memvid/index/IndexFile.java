package dev.memvid.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * On-disk layout of a memvid index file: a JSON document holding frames and memory cards.
 *
 * <pre>{@code
 * {
 *   "version": 1,
 *   "frames": [{"id": 1, "uri": "mv2://resume/skills", "title": "Skills", "text": "...",
 *               "labels": ["skills"], "tags": ["java"], "timestamp": 1700000000,
 *               "metadata": {"section": "skills"}}],
 *   "memory_cards": [{"entity": "__profile__", "slot": "data", "value": "{...}"}]
 * }
 * }</pre>
 *
 * @param version format version, currently {@value #CURRENT_VERSION}
 * @param frames indexed frames in insertion order
 * @param memoryCards entity slots
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record IndexFile(
    int version,
    @Nullable List<Frame> frames,
    @JsonProperty("memory_cards") @Nullable List<MemoryCard> memoryCards) {

  static final int CURRENT_VERSION = 1;

  IndexFile {
    frames = frames == null ? List.of() : List.copyOf(frames);
    memoryCards = memoryCards == null ? List.of() : List.copyOf(memoryCards);
  }

  /**
   * One indexed unit of content.
   *
   * @param id unique frame id, increasing with insertion
   * @param uri document the frame belongs to
   * @param title explicit title, may be absent
   * @param text frame text
   * @param labels labels, most specific first
   * @param tags tags
   * @param timestamp Unix seconds the frame was recorded at, 0 when unknown
   * @param metadata free-form metadata used by scope expressions
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record Frame(
      long id,
      @Nullable String uri,
      @Nullable String title,
      @Nullable String text,
      @Nullable List<String> labels,
      @Nullable List<String> tags,
      long timestamp,
      @Nullable Map<String, String> metadata) {

    Frame {
      if (text == null) {
        throw new IllegalArgumentException("Frame " + id + " has no text");
      }
      uri = uri == null ? "" : uri;
      labels = labels == null ? List.of() : List.copyOf(labels);
      tags = tags == null ? List.of() : List.copyOf(tags);
      metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
  }
}

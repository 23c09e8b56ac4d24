package dev.memvid.index;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A frame matched by the index, with its full text.
 *
 * @param frameId internal frame identifier
 * @param uri document URI the frame belongs to
 * @param title explicit frame title, if the frame has one
 * @param text full frame text
 * @param score relevance score, absent when the strategy produced none
 * @param labels frame labels, most specific first
 * @param tags frame tags
 */
public record IndexHit(
    long frameId,
    String uri,
    @Nullable String title,
    String text,
    @Nullable Float score,
    List<String> labels,
    List<String> tags) {

  public IndexHit {
    labels = List.copyOf(labels);
    tags = List.copyOf(tags);
  }
}

package dev.memvid.searcher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Question-answering request for {@link Searcher#ask}.
 *
 * <p>Filters keep the caller's iteration order; they are serialized into the backend scope
 * expression in that order.
 *
 * @param question the question to answer
 * @param useLlm whether the backend may synthesize an answer; false means context only
 * @param topK maximum number of evidence entries
 * @param filters metadata filters, serialized as {@code key:value} pairs
 * @param start lower time bound in Unix seconds, 0 means unset
 * @param end upper time bound in Unix seconds, 0 means unset
 * @param snippetChars maximum characters per evidence snippet
 * @param mode retrieval strategy
 * @param uri optional document URI to scope retrieval to
 * @param cursor optional opaque pagination cursor
 * @param asOfFrame optional frame id to view the index as of
 * @param asOfTs optional timestamp to view the index as of
 * @param adaptive optional adaptive retrieval switch
 */
public record AskRequest(
    String question,
    boolean useLlm,
    int topK,
    Map<String, String> filters,
    long start,
    long end,
    int snippetChars,
    AskMode mode,
    @Nullable String uri,
    @Nullable String cursor,
    @Nullable Long asOfFrame,
    @Nullable Long asOfTs,
    @Nullable Boolean adaptive) {

  public AskRequest {
    filters = Collections.unmodifiableMap(new LinkedHashMap<>(filters));
  }

  public static Builder builder(String question) {
    return new Builder(question);
  }

  /** Builder with context-only, hybrid defaults (top-k 5, 200-character snippets). */
  public static final class Builder {

    private final String question;
    private boolean useLlm;
    private int topK = 5;
    private Map<String, String> filters = Map.of();
    private long start;
    private long end;
    private int snippetChars = 200;
    private AskMode mode = AskMode.HYBRID;
    private @Nullable String uri;
    private @Nullable String cursor;
    private @Nullable Long asOfFrame;
    private @Nullable Long asOfTs;
    private @Nullable Boolean adaptive;

    private Builder(String question) {
      this.question = question;
    }

    public Builder useLlm(boolean useLlm) {
      this.useLlm = useLlm;
      return this;
    }

    public Builder topK(int topK) {
      this.topK = topK;
      return this;
    }

    public Builder filters(Map<String, String> filters) {
      this.filters = filters;
      return this;
    }

    public Builder timeRange(long start, long end) {
      this.start = start;
      this.end = end;
      return this;
    }

    public Builder snippetChars(int snippetChars) {
      this.snippetChars = snippetChars;
      return this;
    }

    public Builder mode(AskMode mode) {
      this.mode = mode;
      return this;
    }

    public Builder uri(@Nullable String uri) {
      this.uri = uri;
      return this;
    }

    public Builder cursor(@Nullable String cursor) {
      this.cursor = cursor;
      return this;
    }

    public Builder asOfFrame(@Nullable Long asOfFrame) {
      this.asOfFrame = asOfFrame;
      return this;
    }

    public Builder asOfTs(@Nullable Long asOfTs) {
      this.asOfTs = asOfTs;
      return this;
    }

    public Builder adaptive(@Nullable Boolean adaptive) {
      this.adaptive = adaptive;
      return this;
    }

    public AskRequest build() {
      return new AskRequest(
          question,
          useLlm,
          topK,
          filters,
          start,
          end,
          snippetChars,
          mode,
          uri,
          cursor,
          asOfFrame,
          asOfTs,
          adaptive);
    }
  }
}

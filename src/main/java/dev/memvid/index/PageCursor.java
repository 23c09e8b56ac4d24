package dev.memvid.index;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.jspecify.annotations.Nullable;

/** Opaque pagination cursor: a URL-safe Base64 encoding of the next result offset. */
final class PageCursor {

  private static final String PREFIX = "offset:";

  private PageCursor() {}

  static String encode(int offset) {
    return Base64.getUrlEncoder()
        .withoutPadding()
        .encodeToString((PREFIX + offset).getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Decodes a cursor into an offset. Null or empty means the first page.
   *
   * @throws IllegalArgumentException if the cursor was not produced by {@link #encode}
   */
  static int decode(@Nullable String cursor) {
    if (cursor == null || cursor.isEmpty()) {
      return 0;
    }
    try {
      String decoded = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
      if (!decoded.startsWith(PREFIX)) {
        throw new IllegalArgumentException("Invalid cursor: " + cursor);
      }
      int offset = Integer.parseInt(decoded.substring(PREFIX.length()));
      if (offset < 0) {
        throw new IllegalArgumentException("Invalid cursor: " + cursor);
      }
      return offset;
    } catch (IllegalArgumentException e) {
      // NumberFormatException and Base64 decoding errors are IllegalArgumentExceptions too
      throw new IllegalArgumentException("Invalid cursor: " + cursor, e);
    }
  }
}

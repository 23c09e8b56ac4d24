package dev.memvid.index;

import java.io.IOException;
import java.nio.file.Path;

/** Opens index files. Opening may be slow and always blocks the calling thread. */
@FunctionalInterface
public interface MemvidIndexLoader {

  /**
   * Opens the index stored at {@code path}.
   *
   * @throws IOException if the file cannot be read or parsed
   */
  MemvidIndex open(Path path) throws IOException;
}

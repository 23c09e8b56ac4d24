package dev.memvid.searcher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of an entity state lookup.
 *
 * @param found whether the entity exists in the backend
 * @param entity the requested entity name
 * @param slots slot values; always empty when {@code found} is false
 */
public record StateResponse(boolean found, String entity, Map<String, String> slots) {

  public StateResponse {
    if (!found && !slots.isEmpty()) {
      throw new IllegalArgumentException("Unknown entity must not carry slots");
    }
    slots = Collections.unmodifiableMap(new LinkedHashMap<>(slots));
  }

  /** Response for an entity the backend does not know. */
  public static StateResponse notFound(String entity) {
    return new StateResponse(false, entity, Map.of());
  }
}

package dev.memvid.index;

/**
 * One slot value of an entity, stored alongside the frames.
 *
 * @param entity entity name
 * @param slot slot name
 * @param value slot value
 */
public record MemoryCard(String entity, String slot, String value) {

  public MemoryCard {
    if (entity == null || slot == null || value == null) {
      throw new IllegalArgumentException(
          "Memory card needs entity, slot and value: entity=" + entity + ", slot=" + slot);
    }
  }
}

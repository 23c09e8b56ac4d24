package dev.memvid.index;

import org.jspecify.annotations.Nullable;

/**
 * Ask request understood by a {@link MemvidIndex}.
 *
 * @param question question text
 * @param topK page size
 * @param mode retrieval strategy
 * @param start lower timestamp bound (inclusive), unset when null
 * @param end upper timestamp bound (inclusive), unset when null
 * @param contextOnly skip answer synthesis and return context fragments only
 * @param uri restricts fragments to one document URI
 * @param scope scope expression of space-separated {@code key:value} terms
 * @param cursor opaque cursor returned by a previous page
 * @param asOfFrame ignore frames with a higher id
 * @param asOfTs ignore frames with a later timestamp
 * @param adaptive drop fragments scoring far below the best one
 */
public record IndexAskRequest(
    String question,
    int topK,
    RetrievalMode mode,
    @Nullable Long start,
    @Nullable Long end,
    boolean contextOnly,
    @Nullable String uri,
    @Nullable String scope,
    @Nullable String cursor,
    @Nullable Long asOfFrame,
    @Nullable Long asOfTs,
    boolean adaptive) {}

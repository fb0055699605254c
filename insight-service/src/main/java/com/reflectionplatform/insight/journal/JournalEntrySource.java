package com.reflectionplatform.insight.journal;

import java.time.Instant;
import java.util.List;

/**
 * Read access to the journal store, implemented by the persistence layer.
 */
public interface JournalEntrySource {

    /** Entries with {@code start <= createdAt < end}, in any order. */
    List<JournalEntry> findByCreatedAtBetween(Instant start, Instant end);
}

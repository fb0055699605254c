package com.reflectionplatform.insight.journal;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One journal entry as kept by the journal store. Only {@code createdAt} and
 * {@code mood} matter to correlation analysis.
 */
@Data
@NoArgsConstructor
public class JournalEntry {

    private UUID    id;
    private String  title;
    private String  content;
    private Instant createdAt;
    private Instant updatedAt;
    private Short   mood;         // null when the user skipped the mood picker
}

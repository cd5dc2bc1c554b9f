package com.scholary.songscraper.progress;

import java.time.Instant;

/**
 * Immutable snapshot of a phase's progress.
 *
 * @param current items finished so far in this phase, in completion order
 * @param percentage {@code 100 * current / total}, clamped to [0, 100]
 */
public record PhaseProgressView(
    Phase phase,
    int current,
    int total,
    int succeeded,
    int failed,
    double percentage,
    PhaseStatus status,
    String currentItem,
    String errorDetail,
    Instant updatedAt) {}

package com.payment.threatintel.intel;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Outcome of one rebuild attempt.
 */
@Value
@Builder
@Jacksonized
public class RebuildSummary {

    public enum Status {
        COMPLETED,
        /** Another rebuild held the lock. */
        SKIPPED_LOCKED,
        /** The rebuild threw; the previous generation is still current. */
        FAILED
    }

    Status status;
    long generation;
    int sampleCount;
    int clusterCount;
    int activeClusterCount;
    Instant completedAt;

    public static RebuildSummary skipped() {
        return RebuildSummary.builder().status(Status.SKIPPED_LOCKED).completedAt(Instant.now()).build();
    }

    public static RebuildSummary failed() {
        return RebuildSummary.builder().status(Status.FAILED).completedAt(Instant.now()).build();
    }
}

package com.payment.threatintel.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Current aggregate threat record for a payee. Every metric is recomputed from the latest report;
 * only {@code totalReports} accumulates.
 */
@Value
@Builder
@Jacksonized
public class ThreatSnapshot {

    String receiver;
    /** 0–100. */
    double threatScore;
    double avgAgentRisk;
    double behaviorAnomalies;
    List<String> patternFlags;
    double velocityScore;
    double geoAnomalies;
    long totalReports;
    Instant lastSeen;
}

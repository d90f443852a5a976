package com.payment.threatintel.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Read view of a cluster for the API and alerting layer (no centroid).
 */
@Value
@Builder
@Jacksonized
public class ClusterSummary {

    String clusterId;
    String name;
    List<String> members;
    double avgScore;
    int count;
    List<String> topKeywords;
    boolean active;
    Instant updatedAt;
}

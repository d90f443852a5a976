package com.payment.threatintel.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A discovered scam campaign. {@code clusterId} is assigned once and survives rebuilds whenever a new
 * cluster's centroid matches this one closely enough.
 */
@Value
@Builder(toBuilder = true)
public class ScamCluster {

    String clusterId;
    String name;
    /** Distinct payee identifiers, sorted. */
    List<String> members;
    /** Mean snapshot threat score of the members. */
    double avgScore;
    /** At most five keywords, most salient first. */
    List<String> topKeywords;
    double[] centroid;
    boolean active;
    Instant updatedAt;

    public int getSize() {
        return members != null ? members.size() : 0;
    }

    public ClusterSummary toSummary() {
        return ClusterSummary.builder()
                .clusterId(clusterId)
                .name(name)
                .members(members != null ? members : List.of())
                .avgScore(avgScore)
                .count(getSize())
                .topKeywords(topKeywords != null ? topKeywords : List.of())
                .active(active)
                .updatedAt(updatedAt)
                .build();
    }
}

package com.payment.threatintel.persistence.entity;

import com.payment.threatintel.persistence.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.List;

/**
 * One row per payee. Metrics are overwritten by each report; {@code totalReports} is only ever
 * changed by the atomic increment query, and {@link DynamicUpdate} keeps entity saves from writing it.
 */
@Entity
@Table(name = "threat_snapshots", indexes = {
    @Index(name = "idx_threat_snapshot_score", columnList = "threat_score"),
    @Index(name = "idx_threat_snapshot_reports", columnList = "total_reports")
})
@DynamicUpdate
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreatSnapshotEntity {

    @Id
    @Column(name = "receiver", nullable = false)
    private String receiver;

    @Column(name = "threat_score", nullable = false)
    private double threatScore;

    @Column(name = "avg_agent_risk", nullable = false)
    private double avgAgentRisk;

    @Column(name = "behavior_anomalies", nullable = false)
    private double behaviorAnomalies;

    @Convert(converter = StringListConverter.class)
    @Column(name = "pattern_flags", length = 4000)
    private List<String> patternFlags;

    @Column(name = "velocity_score", nullable = false)
    private double velocityScore;

    @Column(name = "geo_anomalies", nullable = false)
    private double geoAnomalies;

    @Column(name = "total_reports", nullable = false)
    private long totalReports;

    @Column(name = "last_seen", nullable = false)
    private Instant lastSeen;
}

package com.payment.threatintel.persistence.entity;

import com.payment.threatintel.persistence.converter.StringListConverter;
import com.payment.threatintel.persistence.converter.VectorConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * A cluster as written by one rebuild generation. The same {@code clusterId} appears once per
 * generation; only the generation named by {@link ClusterGenerationEntity} is visible to readers.
 */
@Entity
@Table(name = "scam_clusters", indexes = {
    @Index(name = "idx_scam_cluster_generation", columnList = "generation"),
    @Index(name = "idx_scam_cluster_active", columnList = "active"),
    @Index(name = "idx_scam_cluster_avg_score", columnList = "avg_score"),
    @Index(name = "idx_scam_cluster_updated_at", columnList = "updated_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScamClusterEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "cluster_id", nullable = false, length = 36)
    private String clusterId;

    @Column(name = "generation", nullable = false)
    private long generation;

    @Column(name = "name", nullable = false, length = 500)
    private String name;

    @Convert(converter = StringListConverter.class)
    @Column(name = "members", length = 65535)
    private List<String> members;

    @Column(name = "member_count", nullable = false)
    private int memberCount;

    @Column(name = "avg_score", nullable = false)
    private double avgScore;

    @Convert(converter = StringListConverter.class)
    @Column(name = "top_keywords", length = 2000)
    private List<String> topKeywords;

    @Convert(converter = VectorConverter.class)
    @Column(name = "centroid", length = 65535)
    private double[] centroid;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}

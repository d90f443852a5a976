package com.payment.threatintel.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Single-row pointer to the cluster generation readers should see. Versioned so two concurrent commits
 * cannot both flip it.
 */
@Entity
@Table(name = "cluster_generation")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterGenerationEntity {

    public static final String CURRENT = "current";

    @Id
    @Column(name = "pointer", nullable = false, length = 32)
    private String pointer;

    @Column(name = "generation", nullable = false)
    private long generation;

    @Column(name = "cluster_count", nullable = false)
    private int clusterCount;

    @Column(name = "committed_at", nullable = false)
    private Instant committedAt;

    @Version
    @Column(name = "version")
    private Long version;
}

package com.payment.threatintel.persistence.service;

import com.payment.threatintel.domain.ScamCluster;
import com.payment.threatintel.persistence.entity.ClusterGenerationEntity;
import com.payment.threatintel.persistence.entity.ScamClusterEntity;
import com.payment.threatintel.persistence.repository.ClusterGenerationRepository;
import com.payment.threatintel.persistence.repository.ScamClusterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Generation-based cluster storage. A rebuild writes a complete new generation and flips the pointer in
 * the same transaction, so readers see either the old set or the new one. The generation just replaced
 * is retained until the next commit for readers that resolved the pointer before the flip.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClusterPersistenceService {

    private final ScamClusterRepository clusterRepository;
    private final ClusterGenerationRepository generationRepository;

    /** 0 when no generation has been committed yet. */
    @Transactional(readOnly = true)
    public long currentGeneration() {
        return generationRepository.findById(ClusterGenerationEntity.CURRENT)
                .map(ClusterGenerationEntity::getGeneration)
                .orElse(0L);
    }

    /** Every cluster of the current generation, active or not. */
    @Transactional(readOnly = true)
    public List<ScamCluster> loadCurrentGeneration() {
        long generation = currentGeneration();
        if (generation == 0L) return List.of();
        return toDomain(clusterRepository.findByGeneration(generation));
    }

    /** Current generation ordered by average score, highest first. */
    @Transactional(readOnly = true)
    public List<ScamCluster> findClusters(boolean includeInactive, int limit) {
        long generation = currentGeneration();
        if (generation == 0L) return List.of();
        PageRequest page = PageRequest.of(0, limit);
        return toDomain(includeInactive
                ? clusterRepository.findByGenerationOrderByAvgScoreDesc(generation, page)
                : clusterRepository.findByGenerationAndActiveTrueOrderByAvgScoreDesc(generation, page));
    }

    @Transactional(readOnly = true)
    public List<ScamCluster> findActiveClusters() {
        long generation = currentGeneration();
        if (generation == 0L) return List.of();
        return toDomain(clusterRepository.findByGenerationAndActiveTrue(generation));
    }

    /**
     * Writes {@code clusters} as the next generation and makes it current.
     *
     * @return the committed generation number
     * @throws org.springframework.orm.ObjectOptimisticLockingFailureException when another instance
     *         committed a generation concurrently; nothing of this call is kept
     */
    @Transactional
    public long commitGeneration(List<ScamCluster> clusters, Instant now) {
        ClusterGenerationEntity pointer = generationRepository.findById(ClusterGenerationEntity.CURRENT)
                .orElseGet(() -> ClusterGenerationEntity.builder()
                        .pointer(ClusterGenerationEntity.CURRENT)
                        .generation(0L)
                        .build());
        long next = pointer.getGeneration() + 1;

        List<ScamClusterEntity> rows = new ArrayList<>(clusters.size());
        for (ScamCluster c : clusters) {
            rows.add(toEntity(c, next));
        }
        clusterRepository.saveAll(rows);

        pointer.setGeneration(next);
        pointer.setClusterCount(clusters.size());
        pointer.setCommittedAt(now);
        generationRepository.save(pointer);

        int removed = clusterRepository.deleteGenerationsBefore(next - 1);
        log.info("Committed cluster generation {} ({} clusters, {} stale rows removed)", next, clusters.size(), removed);
        return next;
    }

    private ScamClusterEntity toEntity(ScamCluster c, long generation) {
        List<String> members = c.getMembers() != null ? new ArrayList<>(c.getMembers()) : new ArrayList<>();
        return ScamClusterEntity.builder()
                .id(UUID.randomUUID().toString())
                .clusterId(c.getClusterId())
                .generation(generation)
                .name(c.getName())
                .members(members)
                .memberCount(members.size())
                .avgScore(c.getAvgScore())
                .topKeywords(c.getTopKeywords() != null ? new ArrayList<>(c.getTopKeywords()) : new ArrayList<>())
                .centroid(c.getCentroid())
                .active(c.isActive())
                .updatedAt(c.getUpdatedAt())
                .build();
    }

    private List<ScamCluster> toDomain(List<ScamClusterEntity> rows) {
        return rows.stream().map(e -> ScamCluster.builder()
                        .clusterId(e.getClusterId())
                        .name(e.getName())
                        .members(e.getMembers() != null ? List.copyOf(e.getMembers()) : List.of())
                        .avgScore(e.getAvgScore())
                        .topKeywords(e.getTopKeywords() != null ? List.copyOf(e.getTopKeywords()) : List.of())
                        .centroid(e.getCentroid())
                        .active(e.isActive())
                        .updatedAt(e.getUpdatedAt())
                        .build())
                .collect(Collectors.toList());
    }
}

package com.payment.threatintel.clustering;

import com.payment.threatintel.domain.ScamCluster;
import com.payment.threatintel.features.KeywordSalienceExtractor;
import com.payment.threatintel.features.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * In-memory cluster rebuild: partitions the event window, names the groups, promotes emerging noise
 * patterns, then reconciles the result with the persisted clusters so campaign ids stay stable.
 */
@Slf4j
@Component
public class ClusteringEngine {

    private final HierarchicalPartitioner partitioner;
    private final ClusterMerger merger;
    private final EmergingClusterDetector emergingDetector;
    private final ClusterLifecyclePolicy lifecyclePolicy;
    private final double identitySimilarityThreshold;

    public ClusteringEngine(HierarchicalPartitioner partitioner,
                            ClusterMerger merger,
                            EmergingClusterDetector emergingDetector,
                            ClusterLifecyclePolicy lifecyclePolicy,
                            @Value("${threat-intel.clustering.identity-similarity-threshold:0.85}") double identitySimilarityThreshold) {
        this.partitioner = partitioner;
        this.merger = merger;
        this.emergingDetector = emergingDetector;
        this.lifecyclePolicy = lifecyclePolicy;
        this.identitySimilarityThreshold = identitySimilarityThreshold;
    }

    /**
     * @param samples  encoded events of the current window
     * @param existing clusters of the current generation
     * @return the complete next generation, lifecycle flags applied
     */
    public List<ScamCluster> rebuild(List<ClusterSample> samples, List<ScamCluster> existing, Instant now) {
        List<ScamCluster> fresh = new ArrayList<>();
        List<ClusterSample> noise = new ArrayList<>();
        int nextIndex = 1;

        if (!samples.isEmpty()) {
            double[][] vectors = samples.stream().map(ClusterSample::getVector).toArray(double[][]::new);
            int[] labels = partitioner.partition(vectors);

            Map<Integer, List<ClusterSample>> groups = new LinkedHashMap<>();
            for (int i = 0; i < labels.length; i++) {
                if (labels[i] == HierarchicalPartitioner.NOISE) {
                    noise.add(samples.get(i));
                } else {
                    groups.computeIfAbsent(labels[i], k -> new ArrayList<>()).add(samples.get(i));
                }
            }
            for (List<ClusterSample> group : groups.values()) {
                fresh.add(toCluster(group, nextIndex++, now));
            }
            List<ScamCluster> emerging = emergingDetector.detect(noise, nextIndex, now);
            fresh.addAll(emerging);
        }
        log.info("Rebuild produced {} raw clusters from {} samples ({} noise)", fresh.size(), samples.size(), noise.size());

        List<ScamCluster> mergedFresh = merger.mergeSimilar(fresh, now);
        List<ScamCluster> dedupedExisting = merger.mergeSimilar(existing, now);
        List<ScamCluster> reconciled = merger.mergeWithExisting(
                mergedFresh, dedupedExisting, identitySimilarityThreshold, now);
        List<ScamCluster> result = lifecyclePolicy.apply(merger.mergeSimilar(reconciled, now), now);

        log.info("Rebuild result: {} clusters ({} active), previous generation had {}",
                result.size(), result.stream().filter(ScamCluster::isActive).count(), existing.size());
        return result;
    }

    private ScamCluster toCluster(List<ClusterSample> group, int fallbackIndex, Instant now) {
        List<String> terms = KeywordSalienceExtractor.topTerms(
                group.stream().map(ClusterSample::document).collect(Collectors.toList()));
        return ScamCluster.builder()
                .clusterId(UUID.randomUUID().toString())
                .name(KeywordSalienceExtractor.clusterName(terms, fallbackIndex))
                .members(EmergingClusterDetector.distinctReceivers(group))
                .avgScore(VectorMath.round(EmergingClusterDetector.memberMeanScore(group), 1))
                .topKeywords(terms)
                .centroid(VectorMath.mean(group.stream().map(ClusterSample::getVector).collect(Collectors.toList())))
                .active(true)
                .updatedAt(now)
                .build();
    }
}

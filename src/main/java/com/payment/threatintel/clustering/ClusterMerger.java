package com.payment.threatintel.clustering;

import com.payment.threatintel.domain.ScamCluster;
import com.payment.threatintel.features.KeywordNormalizer;
import com.payment.threatintel.features.VectorMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Collapses clusters that describe the same campaign, within a batch and against the persisted set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClusterMerger {

    public static final int MAX_KEYWORDS = 5;

    private final ClusterSimilarityPolicy policy;

    /**
     * Repeats the identical-keyword pass and the policy pass until neither merges anything, so no pair
     * in the result would still be merged by the policy.
     */
    public List<ScamCluster> mergeSimilar(List<ScamCluster> clusters, Instant now) {
        List<ScamCluster> current = new ArrayList<>(clusters);
        boolean changed = true;
        while (changed && current.size() > 1) {
            int before = current.size();
            current = mergeIdenticalKeywords(sortBySize(current), now);
            current = mergeByPolicy(current, now);
            changed = current.size() < before;
        }
        return current;
    }

    /**
     * Reconciles freshly computed clusters with the persisted ones: a new cluster whose centroid is at
     * least {@code identityThreshold} cosine-similar to a persisted cluster takes over that cluster's id.
     * Persisted clusters nobody matched are carried forward unchanged.
     */
    public List<ScamCluster> mergeWithExisting(List<ScamCluster> fresh, List<ScamCluster> existing,
                                               double identityThreshold, Instant now) {
        Map<String, ScamCluster> result = new LinkedHashMap<>();
        for (ScamCluster e : existing) result.put(e.getClusterId(), e);

        for (ScamCluster candidate : fresh) {
            ScamCluster best = null;
            double bestSim = -1.0;
            for (ScamCluster e : existing) {
                double sim = VectorMath.cosine(candidate.getCentroid(), e.getCentroid());
                if (sim > bestSim) {
                    bestSim = sim;
                    best = e;
                }
            }
            if (best != null && bestSim >= identityThreshold) {
                log.debug("Cluster '{}' continues existing {} (cosine={})",
                        candidate.getName(), best.getClusterId(), bestSim);
                result.put(best.getClusterId(), mergePayloads(result.get(best.getClusterId()), candidate, now));
            } else {
                result.put(candidate.getClusterId(), candidate);
            }
        }
        return new ArrayList<>(result.values());
    }

    /**
     * Folds {@code other} into {@code base}. Identity (id and name) comes from {@code base}; everything
     * else is symmetric in its arguments.
     */
    public ScamCluster mergePayloads(ScamCluster base, ScamCluster other, Instant now) {
        Set<String> members = new TreeSet<>();
        if (base.getMembers() != null) members.addAll(base.getMembers());
        if (other.getMembers() != null) members.addAll(other.getMembers());

        double[] centroid = base.getCentroid();
        if (centroid != null && other.getCentroid() != null && centroid.length == other.getCentroid().length) {
            centroid = VectorMath.mean(List.of(base.getCentroid(), other.getCentroid()));
        } else if (centroid == null) {
            centroid = other.getCentroid();
        }

        return base.toBuilder()
                .members(new ArrayList<>(members))
                .avgScore(VectorMath.round((base.getAvgScore() + other.getAvgScore()) / 2.0, 1))
                .topKeywords(mergeKeywords(base.getTopKeywords(), other.getTopKeywords()))
                .centroid(centroid)
                .active(true)
                .updatedAt(now)
                .build();
    }

    static List<String> mergeKeywords(List<String> a, List<String> b) {
        Map<String, Integer> counts = new TreeMap<>();
        for (String k : KeywordNormalizer.lower(a)) counts.merge(k, 1, Integer::sum);
        for (String k : KeywordNormalizer.lower(b)) counts.merge(k, 1, Integer::sum);
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(MAX_KEYWORDS)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private List<ScamCluster> mergeIdenticalKeywords(List<ScamCluster> sorted, Instant now) {
        boolean[] consumed = new boolean[sorted.size()];
        List<ScamCluster> out = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            if (consumed[i]) continue;
            ScamCluster merged = sorted.get(i);
            Set<String> key = KeywordNormalizer.normalize(merged.getTopKeywords());
            if (!key.isEmpty()) {
                for (int j = i + 1; j < sorted.size(); j++) {
                    if (consumed[j]) continue;
                    if (key.equals(KeywordNormalizer.normalize(sorted.get(j).getTopKeywords()))) {
                        merged = mergePayloads(merged, sorted.get(j), now);
                        consumed[j] = true;
                    }
                }
            }
            out.add(merged);
        }
        return out;
    }

    private List<ScamCluster> mergeByPolicy(List<ScamCluster> clusters, Instant now) {
        boolean[] consumed = new boolean[clusters.size()];
        List<ScamCluster> out = new ArrayList<>();
        for (int i = 0; i < clusters.size(); i++) {
            if (consumed[i]) continue;
            ScamCluster merged = clusters.get(i);
            for (int j = i + 1; j < clusters.size(); j++) {
                if (consumed[j]) continue;
                Optional<MergeReason> reason = policy.shouldMerge(merged, clusters.get(j));
                if (reason.isPresent()) {
                    log.debug("Merging '{}' into '{}' ({})", clusters.get(j).getName(), merged.getName(), reason.get());
                    merged = mergePayloads(merged, clusters.get(j), now);
                    consumed[j] = true;
                }
            }
            out.add(merged);
        }
        return out;
    }

    private static List<ScamCluster> sortBySize(List<ScamCluster> clusters) {
        List<ScamCluster> sorted = new ArrayList<>(clusters);
        sorted.sort(Comparator.comparingInt(ScamCluster::getSize).reversed());
        return sorted;
    }
}

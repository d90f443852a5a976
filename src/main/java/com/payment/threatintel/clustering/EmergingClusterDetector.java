package com.payment.threatintel.clustering;

import com.payment.threatintel.domain.ScamCluster;
import com.payment.threatintel.features.KeywordSalienceExtractor;
import com.payment.threatintel.features.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Promotes groups of noise samples that share a pattern signature to clusters once they are large and
 * severe enough.
 */
@Slf4j
@Component
public class EmergingClusterDetector {

    private static final int SIGNATURE_FLAGS = 3;
    private static final int SIGNATURE_MESSAGE_CHARS = 32;

    private final int minSize;
    private final double minAvgScore;

    public EmergingClusterDetector(@Value("${threat-intel.clustering.emerging.min-size:15}") int minSize,
                                   @Value("${threat-intel.clustering.emerging.min-avg-score:60}") double minAvgScore) {
        this.minSize = minSize;
        this.minAvgScore = minAvgScore;
    }

    /**
     * @param nextIndex first number to use in "Emerging Scam Cluster #N" names
     */
    public List<ScamCluster> detect(List<ClusterSample> noise, int nextIndex, Instant now) {
        Map<String, List<ClusterSample>> bySignature = new LinkedHashMap<>();
        for (ClusterSample s : noise) {
            bySignature.computeIfAbsent(signature(s), k -> new ArrayList<>()).add(s);
        }

        List<ScamCluster> promoted = new ArrayList<>();
        int index = nextIndex;
        for (Map.Entry<String, List<ClusterSample>> entry : bySignature.entrySet()) {
            List<ClusterSample> group = entry.getValue();
            if (group.size() < minSize) continue;
            double meanScore = group.stream().mapToDouble(ClusterSample::getThreatScore).average().orElse(0.0);
            if (meanScore < minAvgScore) continue;

            promoted.add(ScamCluster.builder()
                    .clusterId(UUID.randomUUID().toString())
                    .name(KeywordSalienceExtractor.FALLBACK_NAME_PREFIX + index++)
                    .members(distinctReceivers(group))
                    .avgScore(VectorMath.round(memberMeanScore(group), 1))
                    .topKeywords(mostFrequentFlags(group))
                    .centroid(VectorMath.mean(group.stream().map(ClusterSample::getVector).collect(Collectors.toList())))
                    .active(true)
                    .updatedAt(now)
                    .build());
            log.info("Promoted emerging pattern '{}' ({} samples, mean score {})",
                    entry.getKey(), group.size(), VectorMath.round(meanScore, 1));
        }
        return promoted;
    }

    static String signature(ClusterSample sample) {
        List<String> flags = sample.getPatternFlags() == null ? List.of() : sample.getPatternFlags().stream()
                .filter(Objects::nonNull)
                .map(f -> f.trim().toLowerCase(Locale.ROOT))
                .filter(f -> !f.isEmpty())
                .sorted()
                .limit(SIGNATURE_FLAGS)
                .collect(Collectors.toList());
        if (!flags.isEmpty()) return String.join("|", flags);
        String message = sample.getMessage() == null ? "" : sample.getMessage().toLowerCase(Locale.ROOT);
        return message.length() > SIGNATURE_MESSAGE_CHARS ? message.substring(0, SIGNATURE_MESSAGE_CHARS) : message;
    }

    static List<String> distinctReceivers(List<ClusterSample> samples) {
        return new ArrayList<>(samples.stream()
                .map(ClusterSample::getReceiver)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new)));
    }

    /** Mean threat score over distinct receivers. */
    static double memberMeanScore(List<ClusterSample> samples) {
        Map<String, Double> byReceiver = new HashMap<>();
        for (ClusterSample s : samples) {
            if (s.getReceiver() != null) byReceiver.put(s.getReceiver(), s.getThreatScore());
        }
        return byReceiver.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static List<String> mostFrequentFlags(List<ClusterSample> group) {
        Map<String, Integer> counts = new HashMap<>();
        for (ClusterSample s : group) {
            if (s.getPatternFlags() == null) continue;
            for (String flag : s.getPatternFlags()) {
                if (flag == null || flag.isBlank()) continue;
                counts.merge(flag.trim().toLowerCase(Locale.ROOT), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(ClusterMerger.MAX_KEYWORDS)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}

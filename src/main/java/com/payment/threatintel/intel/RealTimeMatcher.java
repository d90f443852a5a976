package com.payment.threatintel.intel;

import com.payment.threatintel.domain.AgentOutput;
import com.payment.threatintel.domain.AgentOutputs;
import com.payment.threatintel.domain.ClusterMatch;
import com.payment.threatintel.domain.ScamCluster;
import com.payment.threatintel.domain.TransactionContext;
import com.payment.threatintel.features.EmbeddingUnavailableException;
import com.payment.threatintel.features.FeatureEncoder;
import com.payment.threatintel.features.KeywordNormalizer;
import com.payment.threatintel.features.VectorMath;
import com.payment.threatintel.persistence.service.ClusterPersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only check of a just-submitted transaction against the active clusters. Safe to call on every
 * analysis, including while a rebuild is committing; it may see the previous generation.
 *
 * <p>A cluster matches when any of these hold, checked in this order for the reported reason:
 * <ol>
 *   <li>vector similarity at or above the threshold</li>
 *   <li>keyword Jaccard at least 0.5 with two or more shared keywords (similarity floored at the Jaccard)</li>
 *   <li>a shared core scam keyword with vector similarity at least 0.30 (similarity floored at 0.70)</li>
 *   <li>combined score {@code 0.7 * vector + 0.3 * keyword} at or above the threshold</li>
 * </ol>
 * The reported similarity is the combined score raised to every floor that applies.
 */
@Slf4j
@Service
public class RealTimeMatcher {

    static final double VECTOR_WEIGHT = 0.7;
    static final double KEYWORD_WEIGHT = 0.3;
    static final double KEYWORD_MATCH_MIN = 0.5;
    static final int KEYWORD_MATCH_MIN_OVERLAP = 2;
    static final double CORE_KEYWORD_MIN_VECTOR = 0.30;

    private final FeatureEncoder featureEncoder;
    private final ClusterPersistenceService clusterPersistence;
    private final double defaultThreshold;
    private final double coreKeywordFloor;

    public RealTimeMatcher(FeatureEncoder featureEncoder,
                           ClusterPersistenceService clusterPersistence,
                           @Value("${threat-intel.matcher.threshold:0.70}") double defaultThreshold,
                           @Value("${threat-intel.matcher.core-keyword-floor:0.70}") double coreKeywordFloor) {
        this.featureEncoder = featureEncoder;
        this.clusterPersistence = clusterPersistence;
        this.defaultThreshold = defaultThreshold;
        this.coreKeywordFloor = coreKeywordFloor;
    }

    public Optional<ClusterMatch> match(TransactionContext transaction, List<AgentOutput> agentOutputs) {
        return match(transaction, agentOutputs, defaultThreshold);
    }

    public Optional<ClusterMatch> match(TransactionContext transaction, List<AgentOutput> agentOutputs, double threshold) {
        if (transaction == null) return Optional.empty();
        try {
            List<ScamCluster> clusters = clusterPersistence.findActiveClusters();
            if (clusters.isEmpty()) {
                log.debug("No active clusters to match against (none yet, or mid-rebuild)");
                return Optional.empty();
            }
            List<String> flags = AgentOutputs.patternFlags(agentOutputs);
            double[] vector = featureEncoder.encode(
                    SampleText.of(transaction.getReason(), transaction.getReceiver()),
                    flags, AgentOutputs.scores(agentOutputs));
            return bestMatch(vector, KeywordNormalizer.normalize(flags), clusters, threshold);
        } catch (EmbeddingUnavailableException e) {
            log.warn("Cluster match skipped, embedding unavailable: {}", e.getMessage());
            return Optional.empty();
        } catch (Exception e) {
            log.error("Cluster match failed for receiver={}", transaction.getReceiver(), e);
            return Optional.empty();
        }
    }

    Optional<ClusterMatch> bestMatch(double[] vector, Set<String> candidateKeywords,
                                     List<ScamCluster> clusters, double threshold) {
        ClusterMatch best = null;
        for (ScamCluster cluster : clusters) {
            double[] centroid = cluster.getCentroid();
            if (centroid == null || centroid.length != vector.length) {
                log.debug("Skipping cluster {}: centroid dimension {} != {}", cluster.getClusterId(),
                        centroid != null ? centroid.length : 0, vector.length);
                continue;
            }
            Optional<ClusterMatch> candidate = evaluate(vector, candidateKeywords, cluster, threshold);
            if (candidate.isPresent() && (best == null || candidate.get().getSimilarity() > best.getSimilarity())) {
                best = candidate.get();
            }
        }
        return Optional.ofNullable(best);
    }

    private Optional<ClusterMatch> evaluate(double[] vector, Set<String> candidateKeywords,
                                            ScamCluster cluster, double threshold) {
        double vectorSimilarity = VectorMath.cosine(vector, cluster.getCentroid());
        Set<String> clusterKeywords = KeywordNormalizer.normalize(cluster.getTopKeywords());
        Set<String> shared = KeywordNormalizer.intersection(candidateKeywords, clusterKeywords);
        double keywordSimilarity = KeywordNormalizer.jaccard(candidateKeywords, clusterKeywords);
        double combined = VECTOR_WEIGHT * vectorSimilarity + KEYWORD_WEIGHT * keywordSimilarity;

        boolean vectorHit = vectorSimilarity >= threshold;
        boolean keywordHit = keywordSimilarity >= KEYWORD_MATCH_MIN && shared.size() >= KEYWORD_MATCH_MIN_OVERLAP;
        boolean coreHit = !KeywordNormalizer.coreTerms(shared).isEmpty() && vectorSimilarity >= CORE_KEYWORD_MIN_VECTOR;
        boolean combinedHit = combined >= threshold;

        ClusterMatch.Reason reason;
        if (vectorHit) {
            reason = ClusterMatch.Reason.VECTOR_SIMILARITY;
        } else if (keywordHit) {
            reason = ClusterMatch.Reason.KEYWORD_SIMILARITY;
        } else if (coreHit) {
            reason = ClusterMatch.Reason.CORE_KEYWORD;
        } else if (combinedHit) {
            reason = ClusterMatch.Reason.COMBINED_SCORE;
        } else {
            return Optional.empty();
        }

        double similarity = combined;
        if (keywordHit) similarity = Math.max(similarity, keywordSimilarity);
        if (coreHit) similarity = Math.max(similarity, coreKeywordFloor);

        return Optional.of(ClusterMatch.builder()
                .clusterId(cluster.getClusterId())
                .name(cluster.getName())
                .avgScore(cluster.getAvgScore())
                .count(cluster.getSize())
                .topKeywords(cluster.getTopKeywords() != null ? cluster.getTopKeywords() : List.of())
                .similarity(VectorMath.round(similarity, 3))
                .vectorSimilarity(VectorMath.round(vectorSimilarity, 3))
                .keywordSimilarity(VectorMath.round(keywordSimilarity, 3))
                .reason(reason)
                .build());
    }
}

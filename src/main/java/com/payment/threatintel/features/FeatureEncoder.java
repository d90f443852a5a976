package com.payment.threatintel.features;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Builds the fixed-length feature vector used for clustering and matching:
 * {@code [ L2(embedding(message)) | keyword buckets | agent score slots ]}.
 *
 * <p>Keyword buckets trade discrimination for size: distinct flags sharing a bucket look identical to the
 * distance metric. Changing either width invalidates stored centroids, so a full rebuild must follow.
 */
@Slf4j
@Component
public class FeatureEncoder {

    private final EmbeddingModel embeddingModel;
    private final int keywordBuckets;
    private final int agentScoreSlots;

    public FeatureEncoder(EmbeddingModel embeddingModel,
                          @Value("${threat-intel.features.keyword-buckets:128}") int keywordBuckets,
                          @Value("${threat-intel.features.agent-score-slots:8}") int agentScoreSlots) {
        if (keywordBuckets <= 0 || agentScoreSlots < 0) {
            throw new IllegalArgumentException(
                    "Invalid feature layout: buckets=" + keywordBuckets + ", slots=" + agentScoreSlots);
        }
        this.embeddingModel = embeddingModel;
        this.keywordBuckets = keywordBuckets;
        this.agentScoreSlots = agentScoreSlots;
    }

    /**
     * @throws EmbeddingUnavailableException when the embedding model fails
     */
    public double[] encode(String message, List<String> patternFlags, List<Double> agentScores) {
        double[] embedding = embeddingModel.embed(message != null ? message : "");
        if (embedding.length != embeddingModel.dimension()) {
            throw new EmbeddingUnavailableException(
                    "Embedding length " + embedding.length + " != model dimension " + embeddingModel.dimension());
        }
        double[] semantic = VectorMath.l2Normalize(embedding);

        double[] out = new double[dimension()];
        System.arraycopy(semantic, 0, out, 0, semantic.length);

        int offset = semantic.length;
        if (patternFlags != null) {
            for (String flag : patternFlags) {
                if (flag == null || flag.isBlank()) continue;
                int bucket = Math.floorMod(flag.toLowerCase(Locale.ROOT).hashCode(), keywordBuckets);
                out[offset + bucket] = 1.0;
            }
        }

        offset += keywordBuckets;
        if (agentScores != null) {
            int n = Math.min(agentScores.size(), agentScoreSlots);
            for (int i = 0; i < n; i++) {
                Double score = agentScores.get(i);
                out[offset + i] = score != null && Double.isFinite(score) ? score / 100.0 : 0.0;
            }
        }
        return out;
    }

    public int dimension() {
        return embeddingModel.dimension() + keywordBuckets + agentScoreSlots;
    }
}

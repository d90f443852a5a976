package com.payment.threatintel.clustering;

import com.payment.threatintel.domain.ScamCluster;
import com.payment.threatintel.features.KeywordNormalizer;
import com.payment.threatintel.features.VectorMath;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether two clusters describe the same campaign. Rules are checked in {@link MergeReason}
 * order and the first that fires is reported.
 */
@Component
public class ClusterSimilarityPolicy {

    private static final Set<String> LOAN_URGENT = Set.of("loan", "urgent");

    private final double keywordJaccardThreshold;
    private final double centroidCosineThreshold;
    private final int keywordOverlapThreshold;
    private final int coreOverlapThreshold;
    private final double nameOverlapThreshold;

    public ClusterSimilarityPolicy(
            @Value("${threat-intel.clustering.merge.keyword-jaccard:0.4}") double keywordJaccardThreshold,
            @Value("${threat-intel.clustering.merge.centroid-cosine:0.70}") double centroidCosineThreshold,
            @Value("${threat-intel.clustering.merge.keyword-overlap:2}") int keywordOverlapThreshold,
            @Value("${threat-intel.clustering.merge.core-keyword-overlap:2}") int coreOverlapThreshold,
            @Value("${threat-intel.clustering.merge.name-overlap:0.67}") double nameOverlapThreshold) {
        this.keywordJaccardThreshold = keywordJaccardThreshold;
        this.centroidCosineThreshold = centroidCosineThreshold;
        this.keywordOverlapThreshold = keywordOverlapThreshold;
        this.coreOverlapThreshold = coreOverlapThreshold;
        this.nameOverlapThreshold = nameOverlapThreshold;
    }

    /** Policy with the production thresholds, for callers outside the Spring context. */
    public static ClusterSimilarityPolicy defaults() {
        return new ClusterSimilarityPolicy(0.4, 0.70, 2, 2, 0.67);
    }

    public Optional<MergeReason> shouldMerge(ScamCluster a, ScamCluster b) {
        Set<String> rawA = KeywordNormalizer.lower(a.getTopKeywords());
        Set<String> rawB = KeywordNormalizer.lower(b.getTopKeywords());
        Set<String> normA = KeywordNormalizer.normalize(a.getTopKeywords());
        Set<String> normB = KeywordNormalizer.normalize(b.getTopKeywords());
        double jaccard = KeywordNormalizer.jaccard(normA, normB);

        if (!normA.isEmpty() && normA.equals(normB)) {
            return Optional.of(MergeReason.IDENTICAL_KEYWORDS);
        }
        if (jaccard >= keywordJaccardThreshold) {
            return Optional.of(MergeReason.KEYWORD_JACCARD);
        }
        if (VectorMath.cosine(a.getCentroid(), b.getCentroid()) >= centroidCosineThreshold) {
            return Optional.of(MergeReason.CENTROID_COSINE);
        }
        Set<String> sharedNormalized = KeywordNormalizer.intersection(normA, normB);
        if (sharedNormalized.size() >= keywordOverlapThreshold) {
            return Optional.of(MergeReason.KEYWORD_OVERLAP);
        }
        if (coreOverlap(rawA, rawB)) {
            return Optional.of(MergeReason.CORE_KEYWORD_OVERLAP);
        }
        if (!sharedNormalized.isEmpty() && nameJaccard(a.getName(), b.getName()) >= nameOverlapThreshold) {
            return Optional.of(MergeReason.NAME_OVERLAP);
        }
        return Optional.empty();
    }

    private boolean coreOverlap(Set<String> rawA, Set<String> rawB) {
        Set<String> shared = KeywordNormalizer.intersection(rawA, rawB);
        int sharedCore = KeywordNormalizer.coreTerms(shared).size();
        if (KeywordNormalizer.hasPaymentTerm(rawA) && KeywordNormalizer.hasPaymentTerm(rawB)) {
            sharedCore++;
        }
        return sharedCore >= coreOverlapThreshold || shared.containsAll(LOAN_URGENT);
    }

    static double nameJaccard(String a, String b) {
        return KeywordNormalizer.jaccard(nameWords(a), nameWords(b));
    }

    private static Set<String> nameWords(String name) {
        if (name == null) return Set.of();
        return Arrays.stream(name.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(w -> !w.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}

package com.payment.threatintel.clustering;

import com.payment.threatintel.domain.ScamCluster;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ClusterSimilarityPolicy: each merge rule in isolation, plus the negative case.
 */
class ClusterSimilarityPolicyTest {

    private final ClusterSimilarityPolicy policy = ClusterSimilarityPolicy.defaults();

    @Test
    void paymentSynonymsMakeKeywordSetsIdentical() {
        ScamCluster a = cluster("A", List.of("UPI", "loan"), null);
        ScamCluster b = cluster("B", List.of("payment", "loan"), null);

        assertThat(policy.shouldMerge(a, b)).contains(MergeReason.IDENTICAL_KEYWORDS);
    }

    @Test
    void keywordJaccardAboveThreshold() {
        ScamCluster a = cluster("A", List.of("loan", "otp", "fee"), null);
        ScamCluster b = cluster("B", List.of("loan", "otp", "kyc"), null);

        assertThat(policy.shouldMerge(a, b)).contains(MergeReason.KEYWORD_JACCARD);
    }

    @Test
    void closeCentroidsMergeWithoutSharedKeywords() {
        ScamCluster a = cluster("A", List.of("lottery"), new double[]{1.0, 0.0});
        ScamCluster b = cluster("B", List.of("prize"), new double[]{0.8, 0.6});

        assertThat(policy.shouldMerge(a, b)).contains(MergeReason.CENTROID_COSINE);
    }

    @Test
    void sharedCoreKeywordPlusPaymentTermOnBothSides() {
        ClusterSimilarityPolicy strictOverlap = new ClusterSimilarityPolicy(0.4, 0.70, 3, 2, 0.67);
        ScamCluster a = cluster("A", List.of("loan", "upi", "aadhaar", "agent", "approval"), null);
        ScamCluster b = cluster("B", List.of("loan", "paytm", "cashback", "limit", "instant"), null);

        assertThat(strictOverlap.shouldMerge(a, b)).contains(MergeReason.CORE_KEYWORD_OVERLAP);
    }

    @Test
    void similarNamesWithOneSharedKeyword() {
        ScamCluster a = cluster("Otp / Bank / Alert", List.of("otp", "bank", "alert", "blocked", "card"), null);
        ScamCluster b = cluster("Otp / Bank / Alert", List.of("otp", "reward", "points", "expiry", "redeem"), null);

        assertThat(policy.shouldMerge(a, b)).contains(MergeReason.NAME_OVERLAP);
    }

    @Test
    void unrelatedClustersDoNotMerge() {
        ScamCluster a = cluster("Loan / Fee", List.of("loan", "fee"), new double[]{1.0, 0.0});
        ScamCluster b = cluster("Job / Hiring", List.of("job", "hiring"), new double[]{0.0, 1.0});

        assertThat(policy.shouldMerge(a, b)).isEmpty();
    }

    @Test
    void emptyKeywordSetsAreNotIdentical() {
        ScamCluster a = cluster("A", List.of(), null);
        ScamCluster b = cluster("B", List.of(), null);

        assertThat(policy.shouldMerge(a, b)).isEmpty();
    }

    @Test
    void nameJaccardIgnoresPunctuationAndCase() {
        assertThat(ClusterSimilarityPolicy.nameJaccard("Loan / OTP", "loan otp")).isEqualTo(1.0);
        assertThat(ClusterSimilarityPolicy.nameJaccard(null, "loan")).isZero();
    }

    private static ScamCluster cluster(String name, List<String> keywords, double[] centroid) {
        return ScamCluster.builder()
                .clusterId(name)
                .name(name)
                .members(List.of(name + "@upi"))
                .topKeywords(keywords)
                .centroid(centroid)
                .active(true)
                .updatedAt(Instant.EPOCH)
                .build();
    }
}

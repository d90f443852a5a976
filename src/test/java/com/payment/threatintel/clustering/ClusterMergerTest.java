package com.payment.threatintel.clustering;

import com.payment.threatintel.domain.ScamCluster;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ClusterMerger.
 */
class ClusterMergerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private final ClusterMerger merger = new ClusterMerger(ClusterSimilarityPolicy.defaults());

    @Test
    void mergeKeywordsIsCommutativeAndCapped() {
        List<String> a = List.of("loan", "otp", "urgent", "fee");
        List<String> b = List.of("otp", "kyc", "fee", "verify");

        List<String> ab = ClusterMerger.mergeKeywords(a, b);
        List<String> ba = ClusterMerger.mergeKeywords(b, a);

        assertThat(ab).isEqualTo(ba);
        assertThat(ab).containsExactly("fee", "otp", "kyc", "loan", "urgent");
    }

    @Test
    void mergePayloadsKeepsBaseIdentity() {
        ScamCluster base = cluster("base", "Loan / Otp", List.of("a@upi", "b@upi"), 80.0,
                List.of("loan", "otp"), new double[]{1.0, 0.0});
        ScamCluster other = cluster("other", "Otp / Kyc", List.of("b@upi", "c@upi"), 71.0,
                List.of("otp", "kyc"), new double[]{0.0, 1.0});

        ScamCluster merged = merger.mergePayloads(base, other, NOW);

        assertThat(merged.getClusterId()).isEqualTo("base");
        assertThat(merged.getName()).isEqualTo("Loan / Otp");
        assertThat(merged.getMembers()).containsExactly("a@upi", "b@upi", "c@upi");
        assertThat(merged.getAvgScore()).isEqualTo(75.5);
        assertThat(merged.getCentroid()).containsExactly(0.5, 0.5);
        assertThat(merged.getTopKeywords()).containsExactly("otp", "kyc", "loan");
        assertThat(merged.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void mergeSimilarRepeatsUntilNothingMerges() {
        ScamCluster a = cluster("a", "Kyc Fraud Ring", List.of("a1", "a2", "a3"), 80.0,
                List.of("loan", "otp", "fee"), new double[]{1.0, 0.0, 0.0});
        ScamCluster b = cluster("b", "Crypto Desk", List.of("b1"), 70.0,
                List.of("kyc", "verify", "crypto"), new double[]{0.8, 0.6, 0.0});
        ScamCluster c = cluster("c", "Kyc Fraud Ring", List.of("c1", "c2"), 60.0,
                List.of("kyc", "verify", "hiring"), new double[]{0.0, 0.0, 1.0});

        List<ScamCluster> result = merger.mergeSimilar(List.of(b, c, a), NOW);

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getClusterId()).isEqualTo("a");
        assertThat(result.get(0).getMembers()).containsExactly("a1", "a2", "a3", "b1", "c1", "c2");
    }

    @Test
    void unrelatedClustersSurviveMergeSimilar() {
        ScamCluster loan = cluster("loan", "Loan / Fee", List.of("a1", "a2"), 80.0,
                List.of("loan", "fee"), new double[]{1.0, 0.0});
        ScamCluster job = cluster("job", "Job / Hiring", List.of("b1", "b2", "b3"), 70.0,
                List.of("job", "hiring"), new double[]{0.0, 1.0});

        List<ScamCluster> result = merger.mergeSimilar(List.of(loan, job), NOW);

        assertThat(result).extracting(ScamCluster::getClusterId).containsExactly("job", "loan");
    }

    @Test
    void mergeWithExistingKeepsPersistedIdentity() {
        ScamCluster persisted = cluster("persisted-1", "Loan / Otp", List.of("a@upi"), 90.0,
                List.of("loan", "otp"), new double[]{1.0, 0.0, 0.0});
        ScamCluster untouched = cluster("persisted-2", "Job", List.of("z@upi"), 65.0,
                List.of("job"), new double[]{0.0, 0.0, 1.0});
        ScamCluster continuing = cluster("fresh-1", "Loan / Urgent", List.of("b@upi"), 80.0,
                List.of("loan", "urgent"), new double[]{0.99, 0.1, 0.0});
        ScamCluster brandNew = cluster("fresh-2", "Lottery", List.of("c@upi"), 70.0,
                List.of("lottery"), new double[]{0.0, 1.0, 0.0});

        List<ScamCluster> result = merger.mergeWithExisting(
                List.of(continuing, brandNew), List.of(persisted, untouched), 0.85, NOW);

        assertThat(result).extracting(ScamCluster::getClusterId)
                .containsExactly("persisted-1", "persisted-2", "fresh-2");
        assertThat(result.get(0).getMembers()).containsExactly("a@upi", "b@upi");
        assertThat(result.get(0).getName()).isEqualTo("Loan / Otp");
        assertThat(result.get(1)).isSameAs(untouched);
    }

    private static ScamCluster cluster(String id, String name, List<String> members, double avgScore,
                                       List<String> keywords, double[] centroid) {
        return ScamCluster.builder()
                .clusterId(id)
                .name(name)
                .members(members)
                .avgScore(avgScore)
                .topKeywords(keywords)
                .centroid(centroid)
                .active(true)
                .updatedAt(Instant.EPOCH)
                .build();
    }
}

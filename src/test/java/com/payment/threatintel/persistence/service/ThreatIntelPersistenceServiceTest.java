package com.payment.threatintel.persistence.service;

import com.payment.threatintel.domain.AgentOutput;
import com.payment.threatintel.domain.ThreatEvent;
import com.payment.threatintel.domain.ThreatSnapshot;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Persistence tests for ThreatIntelPersistenceService against an in-memory database.
 */
@DataJpaTest
@Import(ThreatIntelPersistenceService.class)
class ThreatIntelPersistenceServiceTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    @Autowired
    private ThreatIntelPersistenceService persistence;

    @Test
    void repeatedReportsAccumulateCountAndOverwriteMetrics() {
        persistence.upsertSnapshot(metrics("fraud@upi", 80.0, List.of("loan"), T0));
        persistence.upsertSnapshot(metrics("fraud@upi", 86.0, List.of("loan", "otp"), T0.plusSeconds(60)));
        ThreatSnapshot third = persistence.upsertSnapshot(metrics("fraud@upi", 84.5, List.of("otp"), T0.plusSeconds(120)));

        assertThat(third.getTotalReports()).isEqualTo(3);
        assertThat(third.getThreatScore()).isEqualTo(84.5);
        assertThat(third.getPatternFlags()).containsExactly("otp");
        assertThat(third.getLastSeen()).isEqualTo(T0.plusSeconds(120));
        assertThat(persistence.findSnapshot("fraud@upi")).map(ThreatSnapshot::getTotalReports).contains(3L);
    }

    @Test
    void trendingRequiresMinimumReports() {
        for (int i = 0; i < 3; i++) persistence.upsertSnapshot(metrics("fresh@upi", 99.0, List.of(), T0));
        for (int i = 0; i < 5; i++) persistence.upsertSnapshot(metrics("steady@upi", 70.0, List.of(), T0));
        for (int i = 0; i < 6; i++) persistence.upsertSnapshot(metrics("worst@upi", 90.0, List.of(), T0));

        List<ThreatSnapshot> trending = persistence.findTrending(5, 5);

        assertThat(trending).extracting(ThreatSnapshot::getReceiver).containsExactly("worst@upi", "steady@upi");
    }

    @Test
    void historyIsNewestFirstAndLimited() {
        persistence.appendEvent(event("fraud@upi", "first", T0));
        persistence.appendEvent(event("fraud@upi", "second", T0.plusSeconds(10)));
        persistence.appendEvent(event("fraud@upi", "third", T0.plusSeconds(20)));
        persistence.appendEvent(event("other@upi", "unrelated", T0.plusSeconds(30)));

        List<ThreatEvent> history = persistence.findHistory("fraud@upi", 2);

        assertThat(history).extracting(ThreatEvent::getReason).containsExactly("third", "second");
        assertThat(history.get(0).getAgentOutputs()).hasSize(1);
        assertThat(history.get(0).getAgentOutputs().get(0).getEvidence()).containsExactly("loan");
        assertThat(persistence.findRecentEvents(2)).extracting(ThreatEvent::getReason)
                .containsExactly("unrelated", "third");
    }

    @Test
    void threatScoresOnlyForKnownReceivers() {
        persistence.upsertSnapshot(metrics("known@upi", 66.0, List.of(), T0));

        Map<String, Double> scores = persistence.findThreatScores(Set.of("known@upi", "unknown@upi"));

        assertThat(scores).containsOnly(Map.entry("known@upi", 66.0));
    }

    private static ThreatSnapshot metrics(String receiver, double score, List<String> flags, Instant lastSeen) {
        return ThreatSnapshot.builder()
                .receiver(receiver)
                .threatScore(score)
                .avgAgentRisk(score)
                .behaviorAnomalies(50.0)
                .patternFlags(flags)
                .velocityScore(15.0)
                .geoAnomalies(0.0)
                .lastSeen(lastSeen)
                .build();
    }

    private static ThreatEvent event(String receiver, String reason, Instant at) {
        return ThreatEvent.builder()
                .receiver(receiver)
                .reason(reason)
                .amount(new BigDecimal("2500.00"))
                .userId("user-1")
                .agentOutputs(List.of(AgentOutput.builder()
                        .agentName(AgentOutput.PATTERN_AGENT).riskScore(80).evidence(List.of("loan")).build()))
                .timestamp(at)
                .build();
    }
}

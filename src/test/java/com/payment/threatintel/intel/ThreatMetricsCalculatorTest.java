package com.payment.threatintel.intel;

import com.payment.threatintel.domain.AgentOutput;
import com.payment.threatintel.domain.ThreatSnapshot;
import com.payment.threatintel.domain.TransactionContext;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ThreatMetricsCalculator.
 */
class ThreatMetricsCalculatorTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private final ThreatMetricsCalculator calculator = new ThreatMetricsCalculator();

    @Test
    void highRiskReportScoresAboveEighty() {
        List<AgentOutput> outputs = List.of(
                agent(AgentOutput.PATTERN_AGENT, 85, List.of("loan", "otp", "urgent")),
                agent(AgentOutput.BEHAVIOR_AGENT, 85, List.of()),
                agent(AgentOutput.NETWORK_AGENT, 85, List.of()));
        TransactionContext tx = TransactionContext.builder()
                .receiver("fraud@upi").amount(BigDecimal.valueOf(500)).time("14:00").build();

        ThreatSnapshot snapshot = calculator.compute("fraud@upi", outputs, tx, NOW);

        assertThat(snapshot.getThreatScore()).isEqualTo(83.0);
        assertThat(snapshot.getAvgAgentRisk()).isEqualTo(85.0);
        assertThat(snapshot.getBehaviorAnomalies()).isEqualTo(85.0);
        assertThat(snapshot.getPatternFlags()).containsExactly("loan", "otp", "urgent");
        assertThat(snapshot.getTotalReports()).isZero();
        assertThat(snapshot.getLastSeen()).isEqualTo(NOW);
    }

    @Test
    void scoreIsClampedToHundred() {
        List<AgentOutput> outputs = List.of(
                agent(AgentOutput.PATTERN_AGENT, 100, List.of("a", "b", "c", "d", "e", "f")),
                agent(AgentOutput.BEHAVIOR_AGENT, 100, List.of()));
        TransactionContext tx = TransactionContext.builder()
                .receiver("x@upi").amount(BigDecimal.valueOf(50_000)).time("23:15").geoAnomalyScore(100.0).build();

        ThreatSnapshot snapshot = calculator.compute("x@upi", outputs, tx, NOW);

        assertThat(snapshot.getThreatScore()).isEqualTo(100.0);
        assertThat(snapshot.getPatternFlags()).hasSize(5);
    }

    @Test
    void noOutputsScoreZero() {
        ThreatSnapshot snapshot = calculator.compute("quiet@upi", null, null, NOW);

        assertThat(snapshot.getThreatScore()).isZero();
        assertThat(snapshot.getPatternFlags()).isEmpty();
    }

    @Test
    void velocityTiersAndLateNightBonus() {
        assertThat(ThreatMetricsCalculator.velocityScore(tx(25_000, "23:30"))).isEqualTo(55.0);
        assertThat(ThreatMetricsCalculator.velocityScore(tx(20_000, "12:00"))).isEqualTo(40.0);
        assertThat(ThreatMetricsCalculator.velocityScore(tx(12_000, null))).isEqualTo(25.0);
        assertThat(ThreatMetricsCalculator.velocityScore(tx(6_000, "03:00"))).isEqualTo(30.0);
        assertThat(ThreatMetricsCalculator.velocityScore(tx(100, "05:59"))).isEqualTo(15.0);
        assertThat(ThreatMetricsCalculator.velocityScore(tx(100, "06:00"))).isZero();
    }

    @Test
    void unparseableTimeIsIgnored() {
        assertThat(ThreatMetricsCalculator.parseHour("25:00")).isNull();
        assertThat(ThreatMetricsCalculator.parseHour("noon")).isNull();
        assertThat(ThreatMetricsCalculator.parseHour(" 7:45")).isEqualTo(7);
    }

    @Test
    void roundsHalfUp() {
        assertThat(ThreatMetricsCalculator.round1(82.25)).isEqualTo(82.3);
        assertThat(ThreatMetricsCalculator.round1(82.24)).isEqualTo(82.2);
    }

    private static TransactionContext tx(long amount, String time) {
        return TransactionContext.builder().receiver("r@upi").amount(BigDecimal.valueOf(amount)).time(time).build();
    }

    private static AgentOutput agent(String name, double score, List<String> evidence) {
        return AgentOutput.builder().agentName(name).riskScore(score).evidence(evidence).build();
    }
}

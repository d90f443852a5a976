package com.payment.threatintel.alerting;

import com.payment.threatintel.domain.AgentOutput;
import com.payment.threatintel.domain.ClusterMatch;
import com.payment.threatintel.domain.ClusterSummary;
import com.payment.threatintel.domain.TransactionContext;
import com.payment.threatintel.domain.TrendingThreat;
import com.payment.threatintel.intel.RealTimeMatcher;
import com.payment.threatintel.intel.ThreatIntelService;
import com.payment.threatintel.intel.ThreatLookupService;
import com.payment.threatintel.messaging.ThreatAlertProducer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ThreatAlertEvaluator.
 */
@ExtendWith(MockitoExtension.class)
class ThreatAlertEvaluatorTest {

    @Mock
    private ThreatLookupService lookupService;

    @Mock
    private RealTimeMatcher matcher;

    @Mock
    private ThreatIntelService threatIntelService;

    @Mock
    private ThreatAlertProducer alertProducer;

    private ThreatAlertEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new ThreatAlertEvaluator(lookupService, matcher, threatIntelService, alertProducer);
        ReflectionTestUtils.setField(evaluator, "criticalThreatScore", 80.0);
        ReflectionTestUtils.setField(evaluator, "highSimilarity", 0.85);
        ReflectionTestUtils.setField(evaluator, "publishEnabled", true);
    }

    @Test
    void noSignalNoAlert() {
        when(lookupService.checkTrending("clean@upi")).thenReturn(Optional.empty());
        when(lookupService.checkMember("clean@upi")).thenReturn(Optional.empty());
        when(matcher.match(any(), any())).thenReturn(Optional.empty());

        assertThat(evaluator.evaluateAndPublish(tx("clean@upi"), List.of())).isEmpty();
        verify(alertProducer, never()).send(any());
    }

    @Test
    void severeTrendingPayeeIsCritical() {
        when(lookupService.checkTrending("hot@upi")).thenReturn(Optional.of(TrendingThreat.builder()
                .receiver("hot@upi").threatScore(92.0).totalReports(9).patternFlags(List.of("otp")).build()));
        when(lookupService.checkMember("hot@upi")).thenReturn(Optional.empty());
        when(matcher.match(any(), any())).thenReturn(Optional.empty());

        ThreatAlert alert = evaluator.evaluateAndPublish(tx("hot@upi"), List.of()).orElseThrow();

        assertThat(alert.getLevel()).isEqualTo(AlertLevel.CRITICAL);
        assertThat(alert.getReasons()).containsExactly(ThreatAlertReason.TRENDING_PAYEE);
        assertThat(alert.getThreatScore()).isEqualTo(92.0);
        assertThat(alert.getSummary()).isEqualTo("Payee trending with threat score 92.0 over 9 reports");
        verify(alertProducer).send(alert);
    }

    @Test
    void clusterMemberSkipsMatcher() {
        when(lookupService.checkTrending("member@upi")).thenReturn(Optional.empty());
        when(lookupService.checkMember("member@upi")).thenReturn(Optional.of(ClusterSummary.builder()
                .clusterId("c1").name("Loan / Otp").avgScore(71.0).count(4)
                .members(List.of("member@upi")).build()));
        when(threatIntelService.getScore("member@upi")).thenReturn(64.0);

        ThreatAlert alert = evaluator.evaluate(tx("member@upi"), List.of()).orElseThrow();

        assertThat(alert.getLevel()).isEqualTo(AlertLevel.HIGH);
        assertThat(alert.getReasons()).containsExactly(ThreatAlertReason.CLUSTER_MEMBER);
        assertThat(alert.getClusterId()).isEqualTo("c1");
        assertThat(alert.getThreatScore()).isEqualTo(64.0);
        verify(matcher, never()).match(any(), any());
    }

    @Test
    void moderatePatternMatchIsMedium() {
        when(lookupService.checkTrending("new@upi")).thenReturn(Optional.empty());
        when(lookupService.checkMember("new@upi")).thenReturn(Optional.empty());
        when(matcher.match(any(), any())).thenReturn(Optional.of(ClusterMatch.builder()
                .clusterId("c2").name("Job / Hiring").similarity(0.72)
                .reason(ClusterMatch.Reason.CORE_KEYWORD).build()));

        ThreatAlert alert = evaluator.evaluate(tx("new@upi"), outputs()).orElseThrow();

        assertThat(alert.getLevel()).isEqualTo(AlertLevel.MEDIUM);
        assertThat(alert.getReasons()).containsExactly(ThreatAlertReason.CLUSTER_PATTERN_MATCH);
        assertThat(alert.getSimilarity()).isEqualTo(0.72);
        assertThat(alert.getClusterName()).isEqualTo("Job / Hiring");
        assertThat(alert.getAmount()).isEqualByComparingTo("4999");
    }

    @Test
    void publishingCanBeDisabled() {
        ReflectionTestUtils.setField(evaluator, "publishEnabled", false);
        when(lookupService.checkTrending("hot@upi")).thenReturn(Optional.of(TrendingThreat.builder()
                .receiver("hot@upi").threatScore(70.0).totalReports(5).build()));
        when(lookupService.checkMember("hot@upi")).thenReturn(Optional.empty());
        when(matcher.match(any(), any())).thenReturn(Optional.empty());

        Optional<ThreatAlert> alert = evaluator.evaluateAndPublish(tx("hot@upi"), List.of());

        assertThat(alert).map(ThreatAlert::getLevel).contains(AlertLevel.HIGH);
        verify(alertProducer, never()).send(any());
    }

    private static TransactionContext tx(String receiver) {
        return TransactionContext.builder().receiver(receiver).amount(new BigDecimal("4999")).reason("job fee").build();
    }

    private static List<AgentOutput> outputs() {
        return List.of(AgentOutput.builder().agentName(AgentOutput.PATTERN_AGENT).riskScore(70)
                .evidence(List.of("job")).build());
    }
}

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
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Combines the trending list, cluster membership and the real-time matcher into one alert decision for
 * a pending transaction. Cluster checks that come back empty (no data, or a rebuild in progress) simply
 * contribute nothing.
 */
@Slf4j
@Service
public class ThreatAlertEvaluator {

    private final ThreatLookupService lookupService;
    private final RealTimeMatcher matcher;
    private final ThreatIntelService threatIntelService;
    private final ThreatAlertProducer alertProducer;

    @Value("${threat-intel.alerts.critical-threat-score:80}")
    private double criticalThreatScore;

    @Value("${threat-intel.alerts.high-similarity:0.85}")
    private double highSimilarity;

    @Value("${threat-intel.alerts.publish-enabled:true}")
    private boolean publishEnabled;

    public ThreatAlertEvaluator(ThreatLookupService lookupService,
                                RealTimeMatcher matcher,
                                ThreatIntelService threatIntelService,
                                ThreatAlertProducer alertProducer) {
        this.lookupService = lookupService;
        this.matcher = matcher;
        this.threatIntelService = threatIntelService;
        this.alertProducer = alertProducer;
    }

    /** Evaluates and, when an alert results, publishes it. */
    public Optional<ThreatAlert> evaluateAndPublish(TransactionContext transaction, List<AgentOutput> agentOutputs) {
        Optional<ThreatAlert> alert = evaluate(transaction, agentOutputs);
        if (alert.isPresent() && publishEnabled) {
            alertProducer.send(alert.get());
        }
        return alert;
    }

    public Optional<ThreatAlert> evaluate(TransactionContext transaction, List<AgentOutput> agentOutputs) {
        if (transaction == null || transaction.getReceiver() == null || transaction.getReceiver().isBlank()) {
            return Optional.empty();
        }
        String receiver = transaction.getReceiver();

        Optional<TrendingThreat> trending = lookupService.checkTrending(receiver);
        Optional<ClusterSummary> membership = lookupService.checkMember(receiver);
        Optional<ClusterMatch> match = membership.isPresent()
                ? Optional.empty()
                : matcher.match(transaction, agentOutputs);

        if (trending.isEmpty() && membership.isEmpty() && match.isEmpty()) {
            log.debug("No threat-intel signal for receiver={}", receiver);
            return Optional.empty();
        }

        Set<ThreatAlertReason> reasons = EnumSet.noneOf(ThreatAlertReason.class);
        List<String> parts = new ArrayList<>();
        AlertLevel level = AlertLevel.LOW;
        double threatScore = trending.map(TrendingThreat::getThreatScore)
                .orElseGet(() -> threatIntelService.getScore(receiver));

        if (trending.isPresent()) {
            reasons.add(ThreatAlertReason.TRENDING_PAYEE);
            level = level.max(trending.get().getThreatScore() >= criticalThreatScore ? AlertLevel.CRITICAL : AlertLevel.HIGH);
            parts.add(String.format(Locale.ROOT, "payee trending with threat score %.1f over %d reports",
                    trending.get().getThreatScore(), trending.get().getTotalReports()));
        }

        String clusterId = null;
        String clusterName = null;
        double similarity = 0.0;
        if (membership.isPresent()) {
            ClusterSummary cluster = membership.get();
            reasons.add(ThreatAlertReason.CLUSTER_MEMBER);
            level = level.max(cluster.getAvgScore() >= criticalThreatScore ? AlertLevel.CRITICAL : AlertLevel.HIGH);
            clusterId = cluster.getClusterId();
            clusterName = cluster.getName();
            parts.add(String.format(Locale.ROOT, "payee belongs to scam cluster '%s' (%d payees)", cluster.getName(), cluster.getCount()));
        } else if (match.isPresent()) {
            ClusterMatch m = match.get();
            reasons.add(ThreatAlertReason.CLUSTER_PATTERN_MATCH);
            level = level.max(m.getSimilarity() >= highSimilarity ? AlertLevel.HIGH : AlertLevel.MEDIUM);
            clusterId = m.getClusterId();
            clusterName = m.getName();
            similarity = m.getSimilarity();
            parts.add(String.format(Locale.ROOT, "transaction resembles scam cluster '%s' (similarity %.2f, %s)",
                    m.getName(), m.getSimilarity(), m.getReason()));
        }

        ThreatAlert alert = ThreatAlert.builder()
                .alertId(UUID.randomUUID().toString())
                .timestamp(Instant.now())
                .receiver(receiver)
                .amount(transaction.getAmount())
                .level(level)
                .reasons(reasons)
                .threatScore(threatScore)
                .clusterId(clusterId)
                .clusterName(clusterName)
                .similarity(similarity)
                .summary(capitalize(String.join("; ", parts)))
                .build();
        log.info("Threat alert for receiver={}: level={}, reasons={}", receiver, level, reasons);
        return Optional.of(alert);
    }

    private static String capitalize(String s) {
        if (s.isEmpty()) return s;
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}

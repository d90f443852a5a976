package com.payment.threatintel.intel;

import com.payment.threatintel.domain.AgentOutput;
import com.payment.threatintel.domain.AgentOutputs;
import com.payment.threatintel.domain.ThreatSnapshot;
import com.payment.threatintel.domain.TransactionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

/**
 * Derives a payee's snapshot metrics from a single report. The threat score is a weighted blend of
 * agent risk, behavioural anomaly, velocity and geo signals plus a bonus per pattern flag.
 */
@Slf4j
@Component
public class ThreatMetricsCalculator {

    static final double WEIGHT_AVG_RISK = 0.6;
    static final double WEIGHT_BEHAVIOR = 0.2;
    static final double WEIGHT_VELOCITY = 0.15;
    static final double WEIGHT_GEO = 0.05;
    static final double POINTS_PER_FLAG = 5.0;
    static final double MAX_FLAG_BONUS = 20.0;

    private static final BigDecimal HIGH_AMOUNT = BigDecimal.valueOf(20_000);
    private static final BigDecimal MEDIUM_AMOUNT = BigDecimal.valueOf(10_000);
    private static final BigDecimal LOW_AMOUNT = BigDecimal.valueOf(5_000);

    /**
     * @return snapshot values for {@code receiver}; {@code totalReports} is left at 0 for the store to fill
     */
    public ThreatSnapshot compute(String receiver, List<AgentOutput> agentOutputs,
                                  TransactionContext transaction, Instant now) {
        double avgRisk = AgentOutputs.averageRisk(agentOutputs);
        double behavior = AgentOutputs.scoreOf(agentOutputs, AgentOutput.BEHAVIOR_AGENT);
        List<String> flags = AgentOutputs.patternFlags(agentOutputs);
        double velocity = velocityScore(transaction);
        double geo = geoAnomaly(transaction);

        double raw = WEIGHT_AVG_RISK * avgRisk
                + WEIGHT_BEHAVIOR * behavior
                + WEIGHT_VELOCITY * velocity
                + WEIGHT_GEO * geo
                + Math.min(POINTS_PER_FLAG * flags.size(), MAX_FLAG_BONUS);
        double threatScore = round1(Math.max(0.0, Math.min(100.0, raw)));

        log.debug("Metrics for receiver={}: avg={}, behavior={}, velocity={}, geo={}, flags={}, score={}",
                receiver, avgRisk, behavior, velocity, geo, flags.size(), threatScore);

        return ThreatSnapshot.builder()
                .receiver(receiver)
                .threatScore(threatScore)
                .avgAgentRisk(round1(avgRisk))
                .behaviorAnomalies(round1(behavior))
                .patternFlags(flags)
                .velocityScore(round1(velocity))
                .geoAnomalies(round1(geo))
                .totalReports(0)
                .lastSeen(now)
                .build();
    }

    /** Amount tier plus a late-night bonus, capped at 100. */
    static double velocityScore(TransactionContext transaction) {
        if (transaction == null) return 0.0;
        double velocity = 0.0;
        BigDecimal amount = transaction.getAmount();
        if (amount != null) {
            if (amount.compareTo(HIGH_AMOUNT) >= 0) {
                velocity += 40;
            } else if (amount.compareTo(MEDIUM_AMOUNT) >= 0) {
                velocity += 25;
            } else if (amount.compareTo(LOW_AMOUNT) >= 0) {
                velocity += 15;
            }
        }
        Integer hour = parseHour(transaction.getTime());
        if (hour != null && (hour >= 22 || hour <= 5)) {
            velocity += 15;
        }
        return Math.min(100.0, velocity);
    }

    static double geoAnomaly(TransactionContext transaction) {
        if (transaction == null || transaction.getGeoAnomalyScore() == null) return 0.0;
        double geo = transaction.getGeoAnomalyScore();
        return Double.isFinite(geo) ? geo : 0.0;
    }

    /** Hour of an "HH:mm" string, null when absent or unparseable. */
    static Integer parseHour(String time) {
        if (time == null || time.isBlank()) return null;
        String hourPart = time.trim().split(":", 2)[0];
        try {
            int hour = Integer.parseInt(hourPart);
            return hour >= 0 && hour <= 23 ? hour : null;
        } catch (NumberFormatException e) {
            log.debug("Ignoring unparseable transaction time '{}'", time);
            return null;
        }
    }

    static double round1(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}

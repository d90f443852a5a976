package com.payment.threatintel.intel;

import com.payment.threatintel.domain.AgentOutput;
import com.payment.threatintel.domain.ThreatEvent;
import com.payment.threatintel.domain.ThreatSnapshot;
import com.payment.threatintel.domain.TransactionContext;
import com.payment.threatintel.persistence.service.ThreatIntelPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Payee threat snapshots and the scam report log. Called from transaction analysis, so no method throws:
 * storage failures are logged and answered with an empty or zero result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThreatIntelService {

    public static final int DEFAULT_HISTORY_LIMIT = 25;
    public static final int DEFAULT_TRENDING_LIMIT = 5;
    /** Payees need at least this many reports to appear in trending. */
    public static final long TRENDING_MIN_REPORTS = 5;

    private final ThreatIntelPersistenceService persistence;
    private final ThreatMetricsCalculator metricsCalculator;
    private final RebuildCoordinator rebuildCoordinator;

    /**
     * A confirmed scam report: refreshes the payee snapshot, then appends the event (which may trigger
     * a cluster rebuild).
     */
    public Optional<ThreatSnapshot> report(TransactionContext transaction, List<AgentOutput> agentOutputs) {
        if (transaction == null || isBlank(transaction.getReceiver())) {
            return Optional.empty();
        }
        Optional<ThreatSnapshot> snapshot = updateSnapshot(transaction.getReceiver(), agentOutputs, transaction);
        recordEvent(transaction, agentOutputs);
        return snapshot;
    }

    /** Appends the report to the event log and counts it towards the next rebuild. */
    public void recordEvent(TransactionContext transaction, List<AgentOutput> agentOutputs) {
        if (transaction == null || isBlank(transaction.getReceiver())) {
            return;
        }
        try {
            persistence.appendEvent(ThreatEvent.builder()
                    .receiver(transaction.getReceiver())
                    .agentOutputs(agentOutputs != null ? agentOutputs : List.of())
                    .amount(transaction.getAmount())
                    .reason(transaction.getReason())
                    .userId(transaction.getUserId())
                    .timestamp(Instant.now())
                    .build());
        } catch (Exception e) {
            log.error("Failed to record threat event: receiver={}", transaction.getReceiver(), e);
            return;
        }
        rebuildCoordinator.onEventRecorded();
    }

    /**
     * Recomputes every metric of the payee's snapshot from this report and increments its report count.
     */
    public Optional<ThreatSnapshot> updateSnapshot(String receiver, List<AgentOutput> agentOutputs,
                                                   TransactionContext transaction) {
        if (isBlank(receiver)) {
            return Optional.empty();
        }
        ThreatSnapshot metrics = metricsCalculator.compute(receiver, agentOutputs, transaction, Instant.now());
        try {
            return Optional.of(upsertWithRetry(metrics));
        } catch (Exception e) {
            log.error("Failed to update threat snapshot: receiver={}", receiver, e);
            return Optional.empty();
        }
    }

    private ThreatSnapshot upsertWithRetry(ThreatSnapshot metrics) {
        try {
            return persistence.upsertSnapshot(metrics);
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent first report for receiver={}, retrying as update", metrics.getReceiver());
            return persistence.upsertSnapshot(metrics);
        }
    }

    /** Current threat score, 0 for unknown payees. */
    public double getScore(String receiver) {
        return getSnapshot(receiver).map(ThreatSnapshot::getThreatScore).orElse(0.0);
    }

    public Optional<ThreatSnapshot> getSnapshot(String receiver) {
        if (isBlank(receiver)) return Optional.empty();
        try {
            return persistence.findSnapshot(receiver);
        } catch (Exception e) {
            log.warn("Snapshot lookup failed for receiver={}: {}", receiver, e.getMessage());
            return Optional.empty();
        }
    }

    /** Newest first. */
    public List<ThreatEvent> getHistory(String receiver, int limit) {
        if (isBlank(receiver) || limit <= 0) return List.of();
        try {
            return persistence.findHistory(receiver, limit);
        } catch (Exception e) {
            log.warn("History lookup failed for receiver={}: {}", receiver, e.getMessage());
            return List.of();
        }
    }

    /** Highest threat scores among payees with enough reports. */
    public List<ThreatSnapshot> getTrending(int limit) {
        if (limit <= 0) return List.of();
        try {
            return persistence.findTrending(TRENDING_MIN_REPORTS, limit);
        } catch (Exception e) {
            log.warn("Trending lookup failed: {}", e.getMessage());
            return List.of();
        }
    }

    public RebuildSummary forceRebuild() {
        return rebuildCoordinator.forceRebuild();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}

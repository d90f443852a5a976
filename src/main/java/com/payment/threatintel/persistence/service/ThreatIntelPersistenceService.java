package com.payment.threatintel.persistence.service;

import com.payment.threatintel.domain.ThreatEvent;
import com.payment.threatintel.domain.ThreatSnapshot;
import com.payment.threatintel.persistence.entity.ThreatEventEntity;
import com.payment.threatintel.persistence.entity.ThreatSnapshotEntity;
import com.payment.threatintel.persistence.repository.ThreatEventRepository;
import com.payment.threatintel.persistence.repository.ThreatSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Durable storage for the report log and payee snapshots. Exceptions propagate; the threat-intel
 * service decides how to degrade.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThreatIntelPersistenceService {

    private final ThreatEventRepository eventRepository;
    private final ThreatSnapshotRepository snapshotRepository;

    @Transactional
    public ThreatEvent appendEvent(ThreatEvent event) {
        ThreatEventEntity entity = ThreatEventEntity.builder()
                .eventId(event.getEventId() != null ? event.getEventId() : UUID.randomUUID().toString())
                .receiver(event.getReceiver())
                .agentOutputs(event.getAgentOutputs() != null ? new ArrayList<>(event.getAgentOutputs()) : new ArrayList<>())
                .amount(event.getAmount())
                .reason(event.getReason())
                .userId(event.getUserId())
                .timestamp(event.getTimestamp())
                .build();
        ThreatEventEntity saved = eventRepository.save(entity);
        log.debug("Persisted threat event: eventId={}, receiver={}", saved.getEventId(), saved.getReceiver());
        return toDomain(saved);
    }

    /**
     * Overwrites every metric of the payee's snapshot with {@code metrics} and atomically adds one to
     * its report count. {@code metrics.totalReports} is ignored.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException when a concurrent first report
     *         for the same payee inserted the row first; retrying the call then takes the update path
     */
    @Transactional
    public ThreatSnapshot upsertSnapshot(ThreatSnapshot metrics) {
        String receiver = metrics.getReceiver();
        Instant lastSeen = metrics.getLastSeen() != null ? metrics.getLastSeen() : Instant.now();
        Optional<ThreatSnapshotEntity> existing = snapshotRepository.findById(receiver);
        if (existing.isPresent()) {
            applyMetrics(existing.get(), metrics, lastSeen);
        } else {
            ThreatSnapshotEntity created = ThreatSnapshotEntity.builder()
                    .receiver(receiver)
                    .totalReports(0)
                    .build();
            applyMetrics(created, metrics, lastSeen);
            snapshotRepository.saveAndFlush(created);
        }
        snapshotRepository.incrementTotalReports(receiver, lastSeen);
        return snapshotRepository.findById(receiver)
                .map(this::toDomain)
                .orElseThrow(() -> new IllegalStateException("Snapshot vanished after upsert: " + receiver));
    }

    @Transactional(readOnly = true)
    public Optional<ThreatSnapshot> findSnapshot(String receiver) {
        return snapshotRepository.findById(receiver).map(this::toDomain);
    }

    /** Threat score per known receiver; unknown receivers are absent from the map. */
    @Transactional(readOnly = true)
    public Map<String, Double> findThreatScores(Collection<String> receivers) {
        Map<String, Double> scores = new HashMap<>();
        if (receivers.isEmpty()) return scores;
        for (ThreatSnapshotEntity e : snapshotRepository.findByReceiverIn(receivers)) {
            scores.put(e.getReceiver(), e.getThreatScore());
        }
        return scores;
    }

    @Transactional(readOnly = true)
    public List<ThreatSnapshot> findTrending(long minReports, int limit) {
        return snapshotRepository
                .findByTotalReportsGreaterThanEqualOrderByThreatScoreDesc(minReports, PageRequest.of(0, limit))
                .stream().map(this::toDomain).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<ThreatEvent> findHistory(String receiver, int limit) {
        return eventRepository.findByReceiverOrderByTimestampDesc(receiver, PageRequest.of(0, limit))
                .stream().map(this::toDomain).collect(Collectors.toList());
    }

    /** Most recent events across all payees, newest first. */
    @Transactional(readOnly = true)
    public List<ThreatEvent> findRecentEvents(int limit) {
        return eventRepository.findAllByOrderByTimestampDesc(PageRequest.of(0, limit))
                .stream().map(this::toDomain).collect(Collectors.toList());
    }

    private void applyMetrics(ThreatSnapshotEntity entity, ThreatSnapshot metrics, Instant lastSeen) {
        entity.setThreatScore(metrics.getThreatScore());
        entity.setAvgAgentRisk(metrics.getAvgAgentRisk());
        entity.setBehaviorAnomalies(metrics.getBehaviorAnomalies());
        entity.setPatternFlags(metrics.getPatternFlags() != null ? new ArrayList<>(metrics.getPatternFlags()) : new ArrayList<>());
        entity.setVelocityScore(metrics.getVelocityScore());
        entity.setGeoAnomalies(metrics.getGeoAnomalies());
        entity.setLastSeen(lastSeen);
    }

    private ThreatSnapshot toDomain(ThreatSnapshotEntity e) {
        return ThreatSnapshot.builder()
                .receiver(e.getReceiver())
                .threatScore(e.getThreatScore())
                .avgAgentRisk(e.getAvgAgentRisk())
                .behaviorAnomalies(e.getBehaviorAnomalies())
                .patternFlags(e.getPatternFlags() != null ? List.copyOf(e.getPatternFlags()) : List.of())
                .velocityScore(e.getVelocityScore())
                .geoAnomalies(e.getGeoAnomalies())
                .totalReports(e.getTotalReports())
                .lastSeen(e.getLastSeen())
                .build();
    }

    private ThreatEvent toDomain(ThreatEventEntity e) {
        return ThreatEvent.builder()
                .eventId(e.getEventId())
                .receiver(e.getReceiver())
                .agentOutputs(e.getAgentOutputs() != null ? List.copyOf(e.getAgentOutputs()) : List.of())
                .amount(e.getAmount())
                .reason(e.getReason())
                .userId(e.getUserId())
                .timestamp(e.getTimestamp())
                .build();
    }
}

package com.payment.threatintel.intel;

import com.payment.threatintel.clustering.ClusterSample;
import com.payment.threatintel.clustering.ClusteringEngine;
import com.payment.threatintel.domain.AgentOutputs;
import com.payment.threatintel.domain.ScamCluster;
import com.payment.threatintel.domain.ThreatEvent;
import com.payment.threatintel.features.FeatureEncoder;
import com.payment.threatintel.persistence.service.ClusterPersistenceService;
import com.payment.threatintel.persistence.service.ThreatIntelPersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Re-clusters the most recent event window and commits the result as a new generation. Any failure
 * (embedding, persistence, clustering) propagates before the commit, so the current generation stays.
 * Callers serialise rebuilds through {@link RebuildCoordinator}.
 */
@Slf4j
@Service
public class ClusterRebuildService {

    private final ThreatIntelPersistenceService threatIntelPersistence;
    private final ClusterPersistenceService clusterPersistence;
    private final FeatureEncoder featureEncoder;
    private final ClusteringEngine clusteringEngine;
    private final int rebuildWindow;

    public ClusterRebuildService(ThreatIntelPersistenceService threatIntelPersistence,
                                 ClusterPersistenceService clusterPersistence,
                                 FeatureEncoder featureEncoder,
                                 ClusteringEngine clusteringEngine,
                                 @Value("${threat-intel.clustering.rebuild-window:600}") int rebuildWindow) {
        this.threatIntelPersistence = threatIntelPersistence;
        this.clusterPersistence = clusterPersistence;
        this.featureEncoder = featureEncoder;
        this.clusteringEngine = clusteringEngine;
        this.rebuildWindow = rebuildWindow;
    }

    public RebuildSummary rebuild() {
        return rebuild(Instant.now());
    }

    RebuildSummary rebuild(Instant now) {
        long started = System.currentTimeMillis();
        List<ThreatEvent> window = threatIntelPersistence.findRecentEvents(rebuildWindow);
        Set<String> receivers = window.stream()
                .map(ThreatEvent::getReceiver)
                .filter(r -> r != null && !r.isBlank())
                .collect(Collectors.toSet());
        Map<String, Double> scores = threatIntelPersistence.findThreatScores(receivers);

        List<ClusterSample> samples = new ArrayList<>(window.size());
        for (ThreatEvent event : window) {
            if (event.getReceiver() == null || event.getReceiver().isBlank()) continue;
            samples.add(toSample(event, scores.getOrDefault(event.getReceiver(), 0.0)));
        }

        List<ScamCluster> existing = clusterPersistence.loadCurrentGeneration();
        List<ScamCluster> next = clusteringEngine.rebuild(samples, existing, now);
        long generation = clusterPersistence.commitGeneration(next, now);

        int active = (int) next.stream().filter(ScamCluster::isActive).count();
        log.info("Cluster rebuild finished: generation={}, samples={}, clusters={}, active={}, took={}ms",
                generation, samples.size(), next.size(), active, System.currentTimeMillis() - started);
        return RebuildSummary.builder()
                .status(RebuildSummary.Status.COMPLETED)
                .generation(generation)
                .sampleCount(samples.size())
                .clusterCount(next.size())
                .activeClusterCount(active)
                .completedAt(now)
                .build();
    }

    private ClusterSample toSample(ThreatEvent event, double threatScore) {
        String message = SampleText.of(event.getReason(), event.getReceiver());
        List<String> flags = AgentOutputs.patternFlags(event.getAgentOutputs());
        double[] vector = featureEncoder.encode(message, flags, AgentOutputs.scores(event.getAgentOutputs()));
        return ClusterSample.builder()
                .receiver(event.getReceiver())
                .message(message)
                .patternFlags(flags)
                .threatScore(threatScore)
                .vector(vector)
                .build();
    }
}

package com.payment.threatintel.intel;

import com.payment.threatintel.domain.ClusterSummary;
import com.payment.threatintel.domain.ScamCluster;
import com.payment.threatintel.domain.ThreatSnapshot;
import com.payment.threatintel.domain.TrendingThreat;
import com.payment.threatintel.persistence.service.ClusterPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only lookups for the alerting layer and API. An empty result can mean "no data yet" or
 * "rebuild in progress"; callers skip cluster-based alerting in both cases.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThreatLookupService {

    public static final int DEFAULT_CLUSTER_LIMIT = 5;
    static final int MEMBER_SCAN_LIMIT = 20;
    static final int TRENDING_SCAN_LIMIT = 10;

    private final ClusterPersistenceService clusterPersistence;
    private final ThreatIntelService threatIntelService;

    /** Current clusters by average score, highest first. */
    public List<ClusterSummary> getClusters(boolean includeInactive, int limit) {
        if (limit <= 0) return List.of();
        try {
            return clusterPersistence.findClusters(includeInactive, limit).stream()
                    .map(ScamCluster::toSummary)
                    .collect(Collectors.toList());
        } catch (Exception e) {
            log.warn("Cluster lookup failed: {}", e.getMessage());
            return List.of();
        }
    }

    /** First of the top active clusters that lists the payee as a member. */
    public Optional<ClusterSummary> checkMember(String receiver) {
        if (receiver == null || receiver.isBlank()) return Optional.empty();
        return getClusters(false, MEMBER_SCAN_LIMIT).stream()
                .filter(c -> c.getMembers() != null && c.getMembers().contains(receiver))
                .findFirst();
    }

    public Optional<TrendingThreat> checkTrending(String receiver) {
        if (receiver == null || receiver.isBlank()) return Optional.empty();
        return threatIntelService.getTrending(TRENDING_SCAN_LIMIT).stream()
                .filter(s -> receiver.equals(s.getReceiver()))
                .findFirst()
                .map(ThreatLookupService::toTrending);
    }

    static TrendingThreat toTrending(ThreatSnapshot snapshot) {
        return TrendingThreat.builder()
                .receiver(snapshot.getReceiver())
                .threatScore(snapshot.getThreatScore())
                .totalReports(snapshot.getTotalReports())
                .patternFlags(snapshot.getPatternFlags() != null ? snapshot.getPatternFlags() : List.of())
                .build();
    }
}

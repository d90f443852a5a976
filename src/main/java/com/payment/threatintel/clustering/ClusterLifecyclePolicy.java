package com.payment.threatintel.clustering;

import com.payment.threatintel.domain.ScamCluster;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A cluster is active while it has enough members and was touched recently.
 */
@Component
public class ClusterLifecyclePolicy {

    private final int minActiveSize;
    private final Duration inactiveAfter;

    public ClusterLifecyclePolicy(@Value("${threat-intel.clustering.min-active-size:3}") int minActiveSize,
                                  @Value("${threat-intel.clustering.inactive-after-days:30}") long inactiveAfterDays) {
        this.minActiveSize = minActiveSize;
        this.inactiveAfter = Duration.ofDays(inactiveAfterDays);
    }

    public boolean isActive(ScamCluster cluster, Instant now) {
        Instant updatedAt = cluster.getUpdatedAt();
        return cluster.getSize() >= minActiveSize
                && updatedAt != null
                && !updatedAt.isBefore(now.minus(inactiveAfter));
    }

    public List<ScamCluster> apply(List<ScamCluster> clusters, Instant now) {
        return clusters.stream()
                .map(c -> c.toBuilder().active(isActive(c, now)).build())
                .collect(Collectors.toList());
    }
}

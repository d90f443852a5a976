package com.payment.threatintel.api;

import com.payment.threatintel.domain.ClusterSummary;
import com.payment.threatintel.domain.ThreatSnapshot;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Dashboard view: trending payees and the most severe active clusters.
 */
@Value
@Builder
public class GlobalIntelDto {

    List<ThreatSnapshot> trending;
    List<ClusterSummary> clusters;
}

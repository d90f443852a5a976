package com.payment.threatintel.alerting;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;

/**
 * Proactive warning for a transaction that is about to be completed. Published to the alerts topic
 * for the notification layer.
 */
@Value
@Builder
@Jacksonized
public class ThreatAlert {

    String alertId;
    Instant timestamp;
    String receiver;
    BigDecimal amount;
    AlertLevel level;
    Set<ThreatAlertReason> reasons;
    /** Payee threat score 0–100 at evaluation time. */
    double threatScore;
    String clusterId;
    String clusterName;
    /** Pattern-match similarity, 0 when the alert has no pattern match. */
    double similarity;
    String summary;
}

package com.payment.threatintel.alerting;

public enum ThreatAlertReason {
    /** Payee is among the top trending reported payees. */
    TRENDING_PAYEE,
    /** Payee is a member of an active scam cluster. */
    CLUSTER_MEMBER,
    /** Transaction resembles an active cluster even though the payee is not a member. */
    CLUSTER_PATTERN_MATCH
}

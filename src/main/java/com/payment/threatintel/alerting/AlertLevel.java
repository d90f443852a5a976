package com.payment.threatintel.alerting;

/**
 * Severity of a threat alert, lowest first.
 */
public enum AlertLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public AlertLevel max(AlertLevel other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}

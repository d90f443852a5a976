package com.payment.threatintel.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Transaction the agents evaluated. {@code receiver} is the payee identifier (e.g. a UPI handle).
 */
@Value
@Builder
@Jacksonized
public class TransactionContext {

    String receiver;
    BigDecimal amount;
    /** Free-text reason typed by the sender. */
    String reason;
    /** Submitting user. */
    String userId;
    /** Local wall-clock time of the transfer as "HH:mm"; optional. */
    String time;
    /** Externally supplied geo signal (0–100); optional. */
    Double geoAnomalyScore;
}

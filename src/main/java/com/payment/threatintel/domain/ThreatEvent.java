package com.payment.threatintel.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * One immutable scam report: the agent outputs plus the transaction context at report time.
 * Replayed by every cluster rebuild.
 */
@Value
@Builder
@Jacksonized
public class ThreatEvent {

    String eventId;
    String receiver;
    List<AgentOutput> agentOutputs;
    BigDecimal amount;
    String reason;
    String userId;
    Instant timestamp;
}

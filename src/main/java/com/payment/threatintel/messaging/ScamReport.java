package com.payment.threatintel.messaging;

import com.payment.threatintel.domain.AgentOutput;
import com.payment.threatintel.domain.TransactionContext;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A confirmed scam report as published by the feedback flow: the transaction the user reported and the
 * agent outputs computed for it.
 */
@Value
@Builder
@Jacksonized
public class ScamReport {

    String reportId;
    TransactionContext transaction;
    List<AgentOutput> agentOutputs;
    Instant reportedAt;
}

package com.payment.threatintel.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Result reported by one independent risk agent for a transaction. The threat-intel core only reads
 * this contract and never looks at agent internals.
 */
@Value
@Builder
@Jacksonized
public class AgentOutput {

    public static final String PATTERN_AGENT = "Pattern Agent";
    public static final String NETWORK_AGENT = "Network Agent";
    public static final String BEHAVIOR_AGENT = "Behavior Agent";
    public static final String BIOMETRIC_AGENT = "Biometric Agent";

    String agentName;
    /** 0–100; higher = riskier. */
    double riskScore;
    String message;
    /** Free-form evidence strings; for the pattern agent these are the matched scam keywords. */
    List<String> evidence;
}

package com.payment.threatintel.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Read helpers over a list of agent outputs. Null-tolerant: a missing list or entry contributes nothing.
 */
public final class AgentOutputs {

    public static final int MAX_PATTERN_FLAGS = 5;

    private AgentOutputs() {
    }

    /** Mean of every agent's risk score, 0 when there are no outputs. */
    public static double averageRisk(List<AgentOutput> outputs) {
        List<Double> scores = scores(outputs);
        if (scores.isEmpty()) return 0.0;
        double sum = 0.0;
        for (double s : scores) sum += s;
        return sum / scores.size();
    }

    /** Risk score of the first output with the given agent name, 0 if that agent did not report. */
    public static double scoreOf(List<AgentOutput> outputs, String agentName) {
        if (outputs == null) return 0.0;
        for (AgentOutput output : outputs) {
            if (output != null && Objects.equals(agentName, output.getAgentName())) {
                return finite(output.getRiskScore());
            }
        }
        return 0.0;
    }

    /** Up to five evidence strings from the pattern agent, in reported order. */
    public static List<String> patternFlags(List<AgentOutput> outputs) {
        if (outputs == null) return List.of();
        for (AgentOutput output : outputs) {
            if (output != null && AgentOutput.PATTERN_AGENT.equals(output.getAgentName())) {
                List<String> evidence = output.getEvidence();
                if (evidence == null) return List.of();
                List<String> flags = new ArrayList<>();
                for (String item : evidence) {
                    if (flags.size() >= MAX_PATTERN_FLAGS) break;
                    if (item != null) flags.add(item);
                }
                return flags;
            }
        }
        return List.of();
    }

    /** Every agent's score in reported order. */
    public static List<Double> scores(List<AgentOutput> outputs) {
        if (outputs == null) return List.of();
        List<Double> scores = new ArrayList<>(outputs.size());
        for (AgentOutput output : outputs) {
            scores.add(output != null ? finite(output.getRiskScore()) : 0.0);
        }
        return scores;
    }

    private static double finite(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}

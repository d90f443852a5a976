package com.payment.threatintel.clustering;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One encoded threat event fed to a rebuild.
 */
@Value
@Builder
public class ClusterSample {

    String receiver;
    String message;
    List<String> patternFlags;
    /** Snapshot threat score of {@code receiver} at rebuild time. */
    double threatScore;
    double[] vector;

    /** Text the keyword extractor sees: message followed by the pattern flags. */
    public String document() {
        StringBuilder sb = new StringBuilder(message != null ? message : "");
        if (patternFlags != null) {
            for (String flag : patternFlags) {
                if (flag != null) sb.append(' ').append(flag);
            }
        }
        return sb.toString();
    }
}

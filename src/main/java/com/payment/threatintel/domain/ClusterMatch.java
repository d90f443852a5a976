package com.payment.threatintel.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A transaction matched against a known active cluster before any report was filed.
 */
@Value
@Builder
@Jacksonized
public class ClusterMatch {

    /** Which rule declared the match. */
    public enum Reason {
        VECTOR_SIMILARITY,
        KEYWORD_SIMILARITY,
        CORE_KEYWORD,
        COMBINED_SCORE
    }

    String clusterId;
    String name;
    double avgScore;
    int count;
    List<String> topKeywords;
    /** Combined score used for ranking, 3 decimals. */
    double similarity;
    double vectorSimilarity;
    double keywordSimilarity;
    Reason reason;
}

package com.payment.threatintel.clustering;

/**
 * Rules under which two clusters are considered the same campaign, in evaluation order.
 */
public enum MergeReason {
    IDENTICAL_KEYWORDS,
    KEYWORD_JACCARD,
    CENTROID_COSINE,
    KEYWORD_OVERLAP,
    CORE_KEYWORD_OVERLAP,
    NAME_OVERLAP
}

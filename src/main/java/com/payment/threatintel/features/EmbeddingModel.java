package com.payment.threatintel.features;

/**
 * Sentence-embedding model used for the semantic part of a feature vector. Implementations must be
 * deterministic for a given model version; the encoder handles normalisation.
 */
public interface EmbeddingModel {

    /**
     * @throws EmbeddingUnavailableException when the model cannot produce a vector
     */
    double[] embed(String text);

    int dimension();
}

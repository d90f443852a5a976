package com.payment.threatintel.features;

/**
 * The embedding model could not produce a vector (service down, circuit open, bad response).
 */
public class EmbeddingUnavailableException extends RuntimeException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

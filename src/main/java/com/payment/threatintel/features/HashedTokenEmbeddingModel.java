package com.payment.threatintel.features;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Local embedding used when no remote model is configured: signed feature hashing of word tokens and
 * character trigrams. Deterministic across JVMs ({@link String#hashCode()} is specified), so vectors
 * written by one instance compare correctly on another.
 * <p>
 * Hashing captures shared vocabulary, not meaning; production deployments should set
 * {@code threat-intel.embedding.remote.enabled=true} and point at a sentence-embedding service.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "threat-intel.embedding.remote.enabled", havingValue = "false", matchIfMissing = true)
public class HashedTokenEmbeddingModel implements EmbeddingModel {

    private static final Pattern TOKEN = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);
    private static final double TRIGRAM_WEIGHT = 0.5;

    private final int dimension;

    public HashedTokenEmbeddingModel(@Value("${threat-intel.embedding.dimension:384}") int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Embedding dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
        log.info("Using local hashed-token embedding model (dimension={})", dimension);
    }

    @Override
    public double[] embed(String text) {
        double[] vector = new double[dimension];
        if (text == null || text.isBlank()) return vector;
        Matcher m = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String token = m.group();
            add(vector, "w:" + token, 1.0);
            String padded = "#" + token + "#";
            for (int i = 0; i + 3 <= padded.length(); i++) {
                add(vector, "c:" + padded.substring(i, i + 3), TRIGRAM_WEIGHT);
            }
        }
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    private void add(double[] vector, String feature, double weight) {
        int h = feature.hashCode();
        int index = Math.floorMod(h, dimension);
        double sign = ((h >>> 16) & 1) == 0 ? 1.0 : -1.0;
        vector[index] += sign * weight;
    }
}

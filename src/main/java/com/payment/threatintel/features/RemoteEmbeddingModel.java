package com.payment.threatintel.features;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Calls the sentence-embedding service ({@code POST {"text": ...}} → {@code {"embedding": [...]}}).
 * Each call goes through the "embedding" retry and circuit breaker; any failure surfaces as
 * {@link EmbeddingUnavailableException} so callers can skip clustering work for that item.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "threat-intel.embedding.remote.enabled", havingValue = "true")
public class RemoteEmbeddingModel implements EmbeddingModel {

    private static final String RESILIENCE_INSTANCE = "embedding";

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final String serviceUrl;
    private final int dimension;

    public RemoteEmbeddingModel(CircuitBreakerRegistry circuitBreakerRegistry,
                                RetryRegistry retryRegistry,
                                @Value("${threat-intel.embedding.remote.url:http://localhost:5001/embed}") String serviceUrl,
                                @Value("${threat-intel.embedding.remote.timeout-ms:2000}") int timeoutMs,
                                @Value("${threat-intel.embedding.dimension:384}") int dimension) {
        this(buildRestTemplate(timeoutMs), circuitBreakerRegistry, retryRegistry, serviceUrl, dimension);
    }

    RemoteEmbeddingModel(RestTemplate restTemplate,
                         CircuitBreakerRegistry circuitBreakerRegistry,
                         RetryRegistry retryRegistry,
                         String serviceUrl,
                         int dimension) {
        this.restTemplate = restTemplate;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(RESILIENCE_INSTANCE);
        this.retry = retryRegistry.retry(RESILIENCE_INSTANCE);
        this.serviceUrl = serviceUrl;
        this.dimension = dimension;
    }

    @Override
    public double[] embed(String text) {
        Supplier<double[]> call = () -> requestEmbedding(text != null ? text : "");
        Supplier<double[]> withRetry = Retry.decorateSupplier(retry, call);
        Supplier<double[]> withCb = CircuitBreaker.decorateSupplier(circuitBreaker, withRetry);
        try {
            return withCb.get();
        } catch (CallNotPermittedException e) {
            throw new EmbeddingUnavailableException("Embedding circuit is open", e);
        } catch (EmbeddingUnavailableException e) {
            throw e;
        } catch (RestClientException e) {
            log.warn("Embedding service call failed: {}", e.getMessage());
            throw new EmbeddingUnavailableException("Embedding service call failed", e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    private double[] requestEmbedding(String text) {
        Map<String, Object> response = restTemplate.postForObject(serviceUrl, Map.of("text", text), Map.class);
        if (response == null || !(response.get("embedding") instanceof List)) {
            throw new EmbeddingUnavailableException("Embedding response missing 'embedding' field");
        }
        List<?> values = (List<?>) response.get("embedding");
        if (values.size() != dimension) {
            throw new EmbeddingUnavailableException(
                    "Embedding dimension " + values.size() + " does not match configured " + dimension);
        }
        double[] vector = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            Object v = values.get(i);
            try {
                vector[i] = v instanceof Number ? ((Number) v).doubleValue() : Double.parseDouble(String.valueOf(v));
            } catch (NumberFormatException e) {
                throw new EmbeddingUnavailableException("Embedding element " + i + " is not a number: " + v, e);
            }
        }
        return vector;
    }

    private static RestTemplate buildRestTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }
}

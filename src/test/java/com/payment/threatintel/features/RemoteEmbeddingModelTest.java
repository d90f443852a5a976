package com.payment.threatintel.features;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for RemoteEmbeddingModel with a mocked RestTemplate.
 */
@ExtendWith(MockitoExtension.class)
class RemoteEmbeddingModelTest {

    private static final String URL = "http://embedding/embed";

    @Mock
    private RestTemplate restTemplate;

    private RemoteEmbeddingModel model;

    @BeforeEach
    void setUp() {
        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .build());
        model = new RemoteEmbeddingModel(restTemplate, CircuitBreakerRegistry.ofDefaults(), retryRegistry, URL, 3);
    }

    @Test
    void returnsEmbeddingFromService() {
        when(restTemplate.postForObject(eq(URL), any(), eq(Map.class)))
                .thenReturn(Map.of("embedding", List.of(0.1, 0.2, 0.3)));

        assertThat(model.embed("urgent loan")).containsExactly(0.1, 0.2, 0.3);
    }

    @Test
    void wrongDimensionIsUnavailable() {
        when(restTemplate.postForObject(eq(URL), any(), eq(Map.class)))
                .thenReturn(Map.of("embedding", List.of(0.1, 0.2)));

        assertThatThrownBy(() -> model.embed("urgent loan")).isInstanceOf(EmbeddingUnavailableException.class);
    }

    @Test
    void numericStringElementsAreAccepted() {
        when(restTemplate.postForObject(eq(URL), any(), eq(Map.class)))
                .thenReturn(Map.of("embedding", List.of(0.1, "0.2", 0.3)));

        assertThat(model.embed("urgent loan")).containsExactly(0.1, 0.2, 0.3);
    }

    @Test
    void nonNumericElementIsUnavailable() {
        when(restTemplate.postForObject(eq(URL), any(), eq(Map.class)))
                .thenReturn(Map.of("embedding", List.of(0.1, "not-a-number", 0.3)));

        assertThatThrownBy(() -> model.embed("urgent loan"))
                .isInstanceOf(EmbeddingUnavailableException.class)
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    void transportFailureIsRetriedThenUnavailable() {
        when(restTemplate.postForObject(eq(URL), any(), eq(Map.class)))
                .thenThrow(new ResourceAccessException("connection refused"));

        assertThatThrownBy(() -> model.embed("urgent loan")).isInstanceOf(EmbeddingUnavailableException.class);
        verify(restTemplate, times(2)).postForObject(eq(URL), any(), eq(Map.class));
    }
}

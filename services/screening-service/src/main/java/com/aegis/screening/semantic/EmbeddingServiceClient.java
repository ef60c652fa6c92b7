package com.aegis.screening.semantic;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Feign client for the sentence embedding service.
 *
 * Circuit Breaker: stops hammering an unavailable model server
 * Retry: transient failures are retried before the call is reported failed
 * No fallback: the semantic matcher degrades a failed call to a zero score
 *
 * @author Aegis Screening Team
 * @since 1.0.0
 */
@FeignClient(
    name = "embedding-service",
    url = "${screening.semantic.embedding-url:http://localhost:8090}",
    configuration = EmbeddingClientConfiguration.class
)
public interface EmbeddingServiceClient {

    @PostMapping("/v1/embeddings")
    @CircuitBreaker(name = "embeddingService")
    @Retry(name = "embeddingService")
    EmbeddingResponse embed(@RequestBody EmbeddingRequest request);
}

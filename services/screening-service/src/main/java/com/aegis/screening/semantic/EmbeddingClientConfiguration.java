package com.aegis.screening.semantic;

import feign.Request;
import feign.RequestInterceptor;
import feign.RequestTemplate;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.TimeUnit;

/**
 * Embedding Feign client configuration: JSON headers and short timeouts,
 * since every call sits on the screening hot path.
 * Registered only through {@link EmbeddingServiceClient}.
 */
public class EmbeddingClientConfiguration {

    @Bean
    public RequestInterceptor embeddingRequestInterceptor() {
        return new EmbeddingRequestInterceptor();
    }

    @Bean
    public Request.Options embeddingRequestOptions() {
        return new Request.Options(500, TimeUnit.MILLISECONDS, 2000, TimeUnit.MILLISECONDS, true);
    }

    private static class EmbeddingRequestInterceptor implements RequestInterceptor {
        @Override
        public void apply(RequestTemplate template) {
            template.header("Content-Type", "application/json");
            template.header("Accept", "application/json");
        }
    }
}

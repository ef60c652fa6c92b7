package com.aegis.screening.semantic;

import com.aegis.screening.config.ScreeningProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the similarity provider from {@code screening.semantic.provider}
 */
@Slf4j
@Configuration
public class SemanticConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "screening.semantic", name = "provider", havingValue = "embedding")
    public SimilarityProvider embeddingSimilarityProvider(EmbeddingServiceClient client,
                                                          ScreeningProperties properties) {
        log.info("Semantic matching uses embedding service at {} (model {})",
            properties.getSemantic().getEmbeddingUrl(), properties.getSemantic().getModel());
        return new EmbeddingSimilarityProvider(client, properties.getSemantic().getModel());
    }

    @Bean
    @ConditionalOnProperty(prefix = "screening.semantic", name = "provider", havingValue = "none", matchIfMissing = true)
    public SimilarityProvider noOpSimilarityProvider() {
        log.info("Semantic matching disabled, similarity provider scores every pair 0");
        return new NoOpSimilarityProvider();
    }

    @Bean
    @ConditionalOnProperty(prefix = "screening.semantic", name = "fail-fast", havingValue = "true")
    public SimilarityProviderProbe similarityProviderProbe(SimilarityProvider similarityProvider) {
        return new SimilarityProviderProbe(similarityProvider);
    }
}

package com.aegis.screening.semantic;

import com.aegis.screening.exception.ScreeningConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

/**
 * Calls the similarity provider once at startup. An unreachable provider is
 * the one failure that stops the service from starting.
 */
@Slf4j
@RequiredArgsConstructor
public class SimilarityProviderProbe implements ApplicationRunner {

    static final String PROBE_NAME = "probe";

    private final SimilarityProvider similarityProvider;

    @Override
    public void run(ApplicationArguments args) {
        try {
            double score = similarityProvider.similarity(PROBE_NAME, PROBE_NAME);
            log.info("Similarity provider {} reachable, probe score {}", similarityProvider.providerName(), score);
        } catch (RuntimeException e) {
            log.error("Similarity provider {} unreachable at startup", similarityProvider.providerName(), e);
            throw new ScreeningConfigurationException(
                "Similarity provider " + similarityProvider.providerName() + " is unreachable", e);
        }
    }
}

package com.aegis.screening.config;

import com.aegis.common.concurrent.ConcurrencyUtils;
import com.aegis.screening.domain.ScreeningThresholds;
import com.aegis.screening.exception.ScreeningConfigurationException;
import com.aegis.screening.payment.PaymentStatisticsTracker;
import com.aegis.screening.persistence.InMemoryScreeningResultStore;
import com.aegis.screening.persistence.ScreeningResultStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Core screening beans derived from {@link ScreeningProperties}
 */
@Slf4j
@Configuration
public class ScreeningConfiguration {

    /**
     * Default thresholds for every screening call that does not override them
     */
    @Bean
    public ScreeningThresholds defaultScreeningThresholds(ScreeningProperties properties) {
        ScreeningProperties.MatchingConfig matching = properties.getMatching();
        ScreeningProperties.DecisionConfig decision = properties.getDecision();
        try {
            ScreeningThresholds thresholds = ScreeningThresholds.builder()
                .fuzzyThreshold(matching.getFuzzyThreshold())
                .similarityThreshold(matching.getSimilarityThreshold())
                .fieldThreshold(matching.getFieldThreshold())
                .blockThreshold(decision.getBlockThreshold())
                .reviewThreshold(decision.getReviewThreshold())
                .blockConfidence(decision.getBlockConfidence())
                .reviewConfidence(decision.getReviewConfidence())
                .clearConfidence(decision.getClearConfidence())
                .noMatchConfidence(decision.getNoMatchConfidence())
                .build();
            log.info("Screening thresholds: {}", thresholds);
            return thresholds;
        } catch (IllegalArgumentException e) {
            throw new ScreeningConfigurationException("Invalid screening thresholds: " + e.getMessage(), e);
        }
    }

    /**
     * Pool running the sender and recipient screenings of each payment.
     * A saturated pool rejects, so the listener thread never screens a party itself.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService paymentScreeningExecutor(ScreeningProperties properties) {
        ScreeningProperties.PaymentConfig payment = properties.getPayment();
        return ConcurrencyUtils.createBoundedExecutor(
            payment.getExecutorCoreSize(),
            Math.max(payment.getExecutorCoreSize(), payment.getExecutorMaxSize()),
            payment.getExecutorQueueCapacity(),
            "payment-screening",
            new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public PaymentStatisticsTracker paymentStatisticsTracker(ScreeningProperties properties) {
        return new PaymentStatisticsTracker(properties.getPayment().getLatencyWindowSize());
    }

    @Bean
    public ScreeningResultStore screeningResultStore(ScreeningProperties properties) {
        return new InMemoryScreeningResultStore(properties.getPayment().getResultStoreCapacity());
    }
}

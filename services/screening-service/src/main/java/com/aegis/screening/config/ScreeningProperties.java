package com.aegis.screening.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tunables of the screening service, bound from {@code screening.*}
 */
@Data
@Validated
@ConfigurationProperties(prefix = "screening")
public class ScreeningProperties {

    @Valid
    private MatchingConfig matching = new MatchingConfig();

    @Valid
    private DecisionConfig decision = new DecisionConfig();

    @Valid
    private PaymentConfig payment = new PaymentConfig();

    @Valid
    private SemanticConfig semantic = new SemanticConfig();

    @Valid
    private WatchlistConfig watchlist = new WatchlistConfig();

    @Valid
    private KafkaConfig kafka = new KafkaConfig();

    @Data
    public static class MatchingConfig {
        /**
         * Minimum weighted lexical score for a fuzzy finding
         */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double fuzzyThreshold = 0.80;

        /**
         * Minimum provider score for a semantic finding
         */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double similarityThreshold = 0.85;

        /**
         * Minimum field score for a field-only finding
         */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double fieldThreshold = 0.85;
    }

    @Data
    public static class DecisionConfig {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double blockThreshold = 0.90;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double reviewThreshold = 0.70;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double blockConfidence = 0.95;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double reviewConfidence = 0.85;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double clearConfidence = 0.90;

        /**
         * Confidence reported when nothing matched at all
         */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double noMatchConfidence = 1.0;
    }

    @Data
    public static class PaymentConfig {
        /**
         * Deadline for screening both parties of one payment
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        /**
         * Number of recent latencies kept for the moving average
         */
        @Min(1)
        private int latencyWindowSize = 1000;

        @Min(2)
        private int executorCoreSize = 8;

        @Min(2)
        private int executorMaxSize = 32;

        @Min(1)
        private int executorQueueCapacity = 500;

        /**
         * Upper bound of payment results kept for lookup
         */
        @Min(1)
        private int resultStoreCapacity = 10_000;
    }

    @Data
    public static class SemanticConfig {
        /**
         * {@code none} or {@code embedding}
         */
        @NotBlank
        private String provider = "none";

        /**
         * Base URL of the sentence embedding service
         */
        private String embeddingUrl = "http://localhost:8090";

        private String model = "all-MiniLM-L6-v2";

        /**
         * Abort startup when the provider cannot be reached
         */
        private boolean failFast = false;
    }

    @Data
    public static class WatchlistConfig {
        @NotBlank
        private String seedLocation = "classpath:watchlist/sample-watchlist.json";

        private boolean loadOnStartup = true;
    }

    @Data
    public static class KafkaConfig {
        @NotBlank
        private String paymentTopic = "payment-events";

        @NotBlank
        private String resultTopic = "screening-results";

        @NotBlank
        private String consumerGroup = "screening-service";

        /**
         * Listener concurrency, which bounds the number of payments in flight
         */
        @Min(1)
        private int concurrency = 4;
    }
}

package com.aegis.screening;

import com.aegis.screening.config.ScreeningProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cloud.openfeign.EnableFeignClients;

/**
 * Sanctions screening service: matches identities and payment parties
 * against watchlists and republishes a decision for every payment.
 *
 * @author Aegis Screening Team
 * @since 1.0.0
 */
@SpringBootApplication
@EnableFeignClients(basePackages = "com.aegis.screening.semantic")
@EnableConfigurationProperties(ScreeningProperties.class)
public class ScreeningServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScreeningServiceApplication.class, args);
    }
}

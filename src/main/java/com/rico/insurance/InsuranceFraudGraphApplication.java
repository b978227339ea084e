package com.rico.insurance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the insurance coverage graph. Enables:
 * <ul>
 *   <li>Temporal coverage periods, provider and succession links per carrier (JPA)</li>
 *   <li>Gap, overlap and coverage accounting queries</li>
 *   <li>Fraud patterns: shopping, underinsurance, chameleon carriers, risk scores</li>
 *   <li>Batch enrichment from SearchCarriers with retry (Resilience4j)</li>
 * </ul>
 */
@SpringBootApplication
public class InsuranceFraudGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(InsuranceFraudGraphApplication.class, args);
    }
}

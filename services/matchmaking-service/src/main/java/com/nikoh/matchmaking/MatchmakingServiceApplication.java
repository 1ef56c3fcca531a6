/**
 * Matchmaking Service Application
 * Identity document verification and compatibility matching for the Nikoh platform
 *
 * Features:
 * - Passport MRZ extraction with OCR fallback
 * - Selfie to passport face comparison
 * - Threshold based automatic verification with manual review queue
 * - Weighted compatibility scoring and ranked partner suggestions
 */
package com.nikoh.matchmaking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@SpringBootApplication
@EnableTransactionManagement
@EnableScheduling
@EnableKafka
public class MatchmakingServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MatchmakingServiceApplication.class, args);
    }
}

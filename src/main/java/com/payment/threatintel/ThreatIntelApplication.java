package com.payment.threatintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the scam threat intelligence service. Provides:
 * <ul>
 *   <li>Per-payee threat snapshots built from confirmed scam reports (PostgreSQL)</li>
 *   <li>Scam campaign clustering with stable cluster ids across rebuilds</li>
 *   <li>Real-time cluster matching and alert decisions (Kafka)</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class ThreatIntelApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThreatIntelApplication.class, args);
    }
}

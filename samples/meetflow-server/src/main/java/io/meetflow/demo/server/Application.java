package io.meetflow.demo.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Webhook receiver and operator API on top of the meetflow starter.
 *
 * <p>Run with: mvn install -DskipTests && mvn -f samples/meetflow-server/pom.xml spring-boot:run
 *
 * <p>Endpoints:
 * POST /webhooks/{zoom|google-meet|teams}     - receive a platform webhook
 * GET  /meetings/{id}/status                  - processing progress of a meeting
 * POST /meetings/{id}/restart                 - re-drive a failed meeting
 * GET  /dead-letters                          - unresolved dead letters
 * POST /dead-letters/{id}/resolve             - mark a dead letter handled
 * POST /dead-letters/{id}/replay              - re-submit a dead letter's work
 * GET  /webhook-failures/metrics              - retry queue counts
 */
@SpringBootApplication
@EnableConfigurationProperties(MeetflowServerProperties.class)
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}

package com.example.hydrant.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;

/**
 * Installs the lifecycle policy and index template behind the daily hydrant-jobs-* indices
 * that {@link com.example.hydrant.service.JobLedgerService} writes job summaries to.
 * <p>
 * Runs once the application is up, so a slow Elasticsearch never delays the workers. If it
 * never succeeds, summaries are still indexed, with dynamic mappings and no retention.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class JobSummaryIndexConfig {

    static final String POLICY_NAME = "hydrant-jobs-policy";
    static final String TEMPLATE_NAME = "hydrant-jobs-template";

    private static final String POLICY_JSON = "elasticsearch/hydrant-jobs-policy.json";
    private static final String TEMPLATE_JSON = "elasticsearch/hydrant-jobs-template.json";

    private final ElasticsearchClient esClient;

    @Value("${hydrant.ledger.index-setup.attempts:5}")
    private int attempts;

    @Value("${hydrant.ledger.index-setup.backoff:PT2S}")
    private Duration backoff;

    @EventListener(ApplicationReadyEvent.class)
    public void installJobSummaryIndexTemplate() {
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                putPolicy();
                putTemplate();
                log.info("Installed {} and {}", POLICY_NAME, TEMPLATE_NAME);
                return;
            } catch (IOException | RuntimeException e) {
                log.warn("Job summary index setup failed (attempt {}/{}): {}", attempt, attempts, e.getMessage());
                if (attempt < attempts && !pause(backoff.multipliedBy(attempt))) {
                    break;
                }
            }
        }
        log.error("Giving up on {}; job summaries fall back to dynamic mappings without retention", TEMPLATE_NAME);
    }

    private void putPolicy() throws IOException {
        try (InputStream json = new ClassPathResource(POLICY_JSON).getInputStream()) {
            esClient.ilm().putLifecycle(r -> r.name(POLICY_NAME).withJson(json));
        }
    }

    private void putTemplate() throws IOException {
        try (InputStream json = new ClassPathResource(TEMPLATE_JSON).getInputStream()) {
            esClient.indices().putIndexTemplate(r -> r.name(TEMPLATE_NAME).withJson(json));
        }
    }

    private static boolean pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

package com.example.hydrant.service;

import com.example.hydrant.model.IdentityKey;
import com.example.hydrant.model.Resource;
import com.example.hydrant.model.ValidationOutcome;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-checks each resource against the external validation service and attaches the
 * outcome as the resource's {@code validationResults}. Never throws: transport errors,
 * unexpected statuses and unreadable replies become a single error record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValidationEnricher {

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${hydrant.validation.url:}")
    private String validationUrl;

    public List<Resource> enrichAll(List<Resource> resources) {
        if (validationUrl == null || validationUrl.isBlank()) {
            log.info("No validation endpoint configured, skipping validation of {} resource(s)", resources.size());
            return resources;
        }
        List<Resource> enriched = new ArrayList<>(resources.size());
        for (Resource resource : resources) {
            enriched.add(enrich(resource, validationUrl));
        }
        return enriched;
    }

    public Resource enrich(Resource resource, String endpoint) {
        IdentityKey identity = resource.getIdentity();
        ValidationOutcome outcome;
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(endpoint, resource, String.class);
            int status = response.getStatusCode().value();
            outcome = status == 200
                    ? parse(identity, response.getBody())
                    : statusError(identity, status);
        } catch (HttpStatusCodeException e) {
            outcome = statusError(identity, e.getStatusCode().value());
        } catch (Exception e) {
            log.warn("Validation call for {} failed: {}", identity, e.getMessage());
            outcome = ValidationOutcome.error(identity, String.valueOf(e.getMessage()));
        }

        resource.annotate(outcome);
        return resource;
    }

    private ValidationOutcome parse(IdentityKey identity, String body) {
        try {
            JsonNode root = objectMapper.readTree(body == null ? "" : body);
            if (root == null || root.isMissingNode() || !root.isObject()) {
                return ValidationOutcome.error(identity, "Validation service returned an unreadable body");
            }
            List<Map<String, Object>> results = new ArrayList<>();
            JsonNode list = root.get("results");
            if (list != null && list.isArray()) {
                for (JsonNode item : list) {
                    results.add(toRecord(item));
                }
            }
            return ValidationOutcome.success(identity, results);
        } catch (Exception e) {
            log.warn("Validation reply for {} could not be parsed: {}", identity, e.getMessage());
            return ValidationOutcome.error(identity, "Validation service returned malformed JSON: " + e.getMessage());
        }
    }

    private Map<String, Object> toRecord(JsonNode item) {
        if (item.isObject()) {
            return objectMapper.convertValue(item, RECORD_TYPE);
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("value", objectMapper.convertValue(item, Object.class));
        return wrapped;
    }

    private static ValidationOutcome statusError(IdentityKey identity, int status) {
        log.warn("Validation service responded with status {} for {}", status, identity);
        return ValidationOutcome.error(identity, "Validation service responded with status " + status);
    }
}

package com.example.hydrant.service;

import com.example.hydrant.model.EntityRecord;
import com.example.hydrant.model.ExtractionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts the extraction payload to the mapping service. The service answers with a JSON array
 * of entity objects, or an object carrying them under {@code resources}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpEntityMapper implements EntityMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${hydrant.mapper.url:}")
    private String mapperUrl;

    @Override
    public List<EntityRecord> map(ExtractionResult extraction) {
        if (mapperUrl == null || mapperUrl.isBlank()) {
            throw new EntityMappingException("No entity mapper configured (hydrant.mapper.url)");
        }

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("transactionId", extraction.transactionId());
        request.put("sourceKind", extraction.sourceKind().name());
        request.put("payload", extraction.payload());

        String body;
        try {
            body = restTemplate.postForObject(mapperUrl, request, String.class);
        } catch (RestClientException e) {
            throw new EntityMappingException("Entity mapper call failed for transaction "
                    + extraction.transactionId() + ": " + e.getMessage(), e);
        }

        List<EntityRecord> records = parse(body);
        log.info("Mapped transaction {} into {} entity record(s)", extraction.transactionId(), records.size());
        return records;
    }

    List<EntityRecord> parse(String body) {
        JsonNode root;
        try {
            root = body == null ? null : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new EntityMappingException("Entity mapper returned malformed JSON", e);
        }

        JsonNode items = root != null && root.isObject() ? root.get("resources") : root;
        if (items == null || !items.isArray()) {
            throw new EntityMappingException("Entity mapper response has no entity array");
        }

        List<EntityRecord> records = new ArrayList<>();
        for (JsonNode item : items) {
            if (!item.isObject()) {
                throw new EntityMappingException("Entity records must be objects, got " + item.getNodeType());
            }
            try {
                records.add(EntityRecord.fromMap(objectMapper.convertValue(item, MAP_TYPE)));
            } catch (IllegalArgumentException e) {
                throw new EntityMappingException("Invalid entity record: " + e.getMessage(), e);
            }
        }
        return records;
    }
}

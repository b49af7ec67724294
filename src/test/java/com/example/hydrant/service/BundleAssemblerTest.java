package com.example.hydrant.service;

import com.example.hydrant.model.Bundle;
import com.example.hydrant.model.BundleEntry;
import com.example.hydrant.model.Resource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BundleAssemblerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private final BundleAssembler assembler = new BundleAssembler(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void assemble_GivesEveryEntryAFreshUri() {
        // Arrange
        List<Resource> resources = List.of(
                new Resource("Patient", "12345"),
                new Resource("Observation", "obs-001"),
                new Resource("Observation", "obs-002"));

        // Act
        Bundle bundle = assembler.assemble(resources, BundleAssembler.DEFAULT_TYPE);

        // Assert
        Set<String> urls = new HashSet<>();
        for (BundleEntry entry : bundle.entries()) {
            assertTrue(entry.fullUrl().startsWith("urn:uuid:"));
            urls.add(entry.fullUrl());
        }
        assertEquals(3, urls.size());
        assertFalse(urls.contains("urn:uuid:" + bundle.id()));
        assertFalse(bundle.id().isBlank());
    }

    @Test
    void assemble_KeepsInputOrderAndTimestamp() {
        List<Resource> resources = List.of(
                new Resource("Observation", "obs-002"),
                new Resource("Patient", "12345"));

        Bundle bundle = assembler.assemble(resources, "batch");

        assertEquals("batch", bundle.type());
        assertEquals("2024-05-01T10:15:30Z", bundle.timestamp());
        assertEquals("obs-002", bundle.entries().get(0).resource().getId());
        assertEquals("12345", bundle.entries().get(1).resource().getId());
    }

    @Test
    void assemble_TwiceGivesDifferentIdentifiers() {
        List<Resource> resources = List.of(new Resource("Patient", "12345"));

        Bundle first = assembler.assemble(resources, BundleAssembler.DEFAULT_TYPE);
        Bundle second = assembler.assemble(resources, BundleAssembler.DEFAULT_TYPE);

        assertNotEquals(first.id(), second.id());
        assertNotEquals(first.entries().get(0).fullUrl(), second.entries().get(0).fullUrl());
    }

    @Test
    void assemble_EmptyInputGivesEmptyBundle() {
        Bundle bundle = assembler.assemble(List.of(), BundleAssembler.DEFAULT_TYPE);

        assertTrue(bundle.entries().isEmpty());
        assertEquals(Bundle.RESOURCE_TYPE, bundle.resourceType());
    }

    @Test
    void assemble_DetachesResourcesFromInput() {
        Resource patient = new Resource("Patient", "12345").withField("gender", "male");

        Bundle bundle = assembler.assemble(List.of(patient), BundleAssembler.DEFAULT_TYPE);
        patient.putField("gender", "female");

        assertEquals("male", bundle.entries().get(0).resource().getField("gender"));
    }

    @Test
    void serialisedBundle_HasExpectedShape() throws Exception {
        Resource patient = new Resource("Patient", "12345")
                .withField("gender", "male")
                .withExtension(Map.of("url", "http://example.org/fhir", "valueString", "Additional"));

        Bundle bundle = assembler.assemble(List.of(patient), BundleAssembler.DEFAULT_TYPE);
        JsonNode json = new ObjectMapper().readTree(new ObjectMapper().writeValueAsString(bundle));

        assertEquals("Bundle", json.get("resourceType").asText());
        assertEquals(bundle.id(), json.get("id").asText());
        assertEquals("collection", json.get("type").asText());
        assertEquals("2024-05-01T10:15:30Z", json.get("timestamp").asText());
        JsonNode entry = json.get("entry").get(0);
        assertEquals(bundle.entries().get(0).fullUrl(), entry.get("fullUrl").asText());
        assertEquals("Patient", entry.get("resource").get("resourceType").asText());
        assertEquals("male", entry.get("resource").get("gender").asText());
        assertEquals("Additional", entry.get("resource").get("extension").get(0).get("valueString").asText());
        assertFalse(entry.get("resource").has("validationResults"));
        assertFalse(entry.get("resource").has("fields"));
    }
}

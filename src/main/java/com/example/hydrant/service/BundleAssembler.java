package com.example.hydrant.service;

import com.example.hydrant.model.Bundle;
import com.example.hydrant.model.BundleEntry;
import com.example.hydrant.model.Resource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Wraps resources into a Bundle. Identifiers are fresh per assembly and unrelated to the
 * resources' own ids. Entry order follows input order; resources are not validated.
 */
@Component
@RequiredArgsConstructor
public class BundleAssembler {

    public static final String DEFAULT_TYPE = "collection";

    private final Clock clock;

    public Bundle assemble(List<Resource> resources, String typeTag) {
        String timestamp = DateTimeFormatter.ISO_INSTANT.format(clock.instant());

        List<BundleEntry> entries = new ArrayList<>(resources.size());
        for (Resource resource : resources) {
            entries.add(new BundleEntry("urn:uuid:" + UUID.randomUUID(), resource.deepCopy()));
        }
        return new Bundle(UUID.randomUUID().toString(), typeTag, timestamp, entries);
    }
}

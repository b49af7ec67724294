package com.example.hydrant.service;

import com.example.hydrant.model.IdentityKey;
import com.example.hydrant.model.Resource;
import com.example.hydrant.model.ResourceSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deduplicates resources by (resourceType, id) in one left-to-right pass.
 * <p>
 * The first sighting of a key is deep-copied and becomes the canonical record. Later
 * sightings contribute extensions not yet present (structural equality, canonical order
 * first); their other fields are handled by the {@link ScalarMergePolicy}. Under
 * {@code FIRST_WINS} the result depends on input order.
 */
@Slf4j
@Component
public class ResourceReconciler {

    private final ScalarMergePolicy scalarPolicy;

    public ResourceReconciler(@Value("${hydrant.reconciliation.scalar-policy:FIRST_WINS}") ScalarMergePolicy scalarPolicy) {
        this.scalarPolicy = scalarPolicy;
    }

    public ResourceSet reconcile(List<Resource> resources) {
        ResourceSet result = new ResourceSet();
        Map<IdentityKey, Set<Map<String, Object>>> seenExtensions = new HashMap<>();
        int merged = 0;

        for (Resource resource : resources) {
            IdentityKey key = IdentityKey.of(resource);

            if (!result.contains(key)) {
                Resource canonical = resource.deepCopy();
                result.putFirst(key, canonical);
                seenExtensions.put(key, new HashSet<>(canonical.getExtensions()));
                continue;
            }

            Resource canonical = result.get(key);
            mergeExtensions(canonical, resource, seenExtensions.get(key));
            if (scalarPolicy == ScalarMergePolicy.LAST_WINS) {
                canonical.getFields().putAll(resource.deepCopy().getFields());
            }
            merged++;
        }

        log.debug("Reconciled {} resource(s) into {} canonical record(s), {} merged",
                resources.size(), result.size(), merged);
        return result;
    }

    private static void mergeExtensions(Resource canonical, Resource duplicate, Set<Map<String, Object>> seen) {
        for (Map<String, Object> extension : duplicate.deepCopy().getExtensions()) {
            if (seen.add(extension)) {
                canonical.getExtensions().add(extension);
            }
        }
    }

    public ScalarMergePolicy getScalarPolicy() {
        return scalarPolicy;
    }
}

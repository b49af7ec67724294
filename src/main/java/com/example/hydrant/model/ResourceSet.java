package com.example.hydrant.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical resources keyed by identity, in order of first sighting.
 * Holds at most one resource per key.
 */
public class ResourceSet {

    private final Map<IdentityKey, Resource> canonical = new LinkedHashMap<>();

    public boolean contains(IdentityKey key) {
        return canonical.containsKey(key);
    }

    public Resource get(IdentityKey key) {
        return canonical.get(key);
    }

    /**
     * Registers the canonical record for a key that has not been seen yet.
     */
    public void putFirst(IdentityKey key, Resource resource) {
        if (canonical.putIfAbsent(key, resource) != null) {
            throw new IllegalStateException("Identity already present: " + key);
        }
    }

    public int size() {
        return canonical.size();
    }

    public Collection<IdentityKey> keys() {
        return Collections.unmodifiableSet(canonical.keySet());
    }

    public List<Resource> toList() {
        return new ArrayList<>(canonical.values());
    }
}

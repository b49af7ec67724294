package com.example.hydrant.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view of one entity produced by the external mapper.
 * <p>
 * Defaulting policy: a missing resourceType becomes {@value #UNKNOWN_TYPE}, a missing
 * or blank id becomes {@link IdentityKey#UNKNOWN_ID}. Every other key of the raw
 * record is kept as a field, in the order the mapper produced it.
 */
public record EntityRecord(
        String resourceType,
        String id,
        Map<String, Object> fields,
        List<Map<String, Object>> extensions) {

    public static final String UNKNOWN_TYPE = "Unknown";

    public EntityRecord {
        resourceType = resourceType == null || resourceType.isBlank() ? UNKNOWN_TYPE : resourceType;
        id = id == null || id.isBlank() ? IdentityKey.UNKNOWN_ID : id;
        fields = fields == null ? Map.of() : fields;
        extensions = extensions == null ? List.of() : extensions;
    }

    /**
     * @throws IllegalArgumentException when {@code extension} is present but not a list of objects,
     *                                  or resourceType/id are not strings
     */
    public static EntityRecord fromMap(Map<String, Object> raw) {
        if (raw == null) {
            throw new IllegalArgumentException("entity record is null");
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        List<Map<String, Object>> extensions = new ArrayList<>();
        String resourceType = null;
        String id = null;

        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            switch (key) {
                case "resourceType" -> resourceType = asString(key, value);
                case "id" -> id = asString(key, value);
                case "extension" -> {
                    if (value == null) {
                        continue;
                    }
                    if (!(value instanceof List<?> list)) {
                        throw new IllegalArgumentException("extension must be a list, got " + value.getClass().getSimpleName());
                    }
                    for (Object item : list) {
                        if (!(item instanceof Map<?, ?> extension)) {
                            throw new IllegalArgumentException("extension entries must be objects, got " + item);
                        }
                        extensions.add(withStringKeys(extension));
                    }
                }
                default -> fields.put(key, value);
            }
        }
        return new EntityRecord(resourceType, id, fields, extensions);
    }

    public Resource toResource() {
        Resource resource = new Resource(resourceType, id);
        fields.forEach(resource::putField);
        extensions.forEach(resource::withExtension);
        // detach from the mapper's maps
        return resource.deepCopy();
    }

    private static Map<String, Object> withStringKeys(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    private static String asString(String key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Number) {
            return value.toString();
        }
        throw new IllegalArgumentException(key + " must be a string, got " + value.getClass().getSimpleName());
    }
}

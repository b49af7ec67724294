package com.example.hydrant.model;

/**
 * (resourceType, id) pair deciding whether two resources denote the same entity.
 */
public record IdentityKey(String resourceType, String id) {

    public static final String UNKNOWN_ID = "unknown";

    public static IdentityKey of(Resource resource) {
        String id = resource.getId();
        return new IdentityKey(resource.getResourceType(), id == null ? UNKNOWN_ID : id);
    }

    @Override
    public String toString() {
        return resourceType + "/" + id;
    }
}

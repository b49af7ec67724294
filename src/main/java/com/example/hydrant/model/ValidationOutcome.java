package com.example.hydrant.model;

import java.util.List;
import java.util.Map;

/**
 * Result of calling the external validation service for one resource.
 * Either the service's result list, or a single error record when {@code failed}.
 */
public record ValidationOutcome(
        IdentityKey identity,
        List<Map<String, Object>> results,
        boolean failed) {

    public static ValidationOutcome success(IdentityKey identity, List<Map<String, Object>> results) {
        return new ValidationOutcome(identity, List.copyOf(results), false);
    }

    public static ValidationOutcome error(IdentityKey identity, String message) {
        return new ValidationOutcome(identity, List.of(Map.of("error", message)), true);
    }
}

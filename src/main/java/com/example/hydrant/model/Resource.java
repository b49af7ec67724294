package com.example.hydrant.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A structured clinical resource. Serialises flat: every entry of {@code fields}
 * sits next to resourceType, id and extension.
 */
@Getter
@Setter
@NoArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"resourceType", "id", "extension", "validationResults"})
public class Resource {

    private String resourceType;

    private String id;

    @Setter(AccessLevel.NONE)
    private Map<String, Object> fields = new LinkedHashMap<>();

    @JsonProperty("extension")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<Map<String, Object>> extensions = new ArrayList<>();

    // Set by the validation stage only
    private List<Map<String, Object>> validationResults;

    public Resource(String resourceType, String id) {
        this.resourceType = resourceType;
        this.id = id;
    }

    @JsonIgnore
    public IdentityKey getIdentity() {
        return IdentityKey.of(this);
    }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return fields;
    }

    @JsonAnySetter
    public void putField(String name, Object value) {
        fields.put(name, value);
    }

    public Object getField(String name) {
        return fields.get(name);
    }

    public Resource withField(String name, Object value) {
        putField(name, value);
        return this;
    }

    public Resource withExtension(Map<String, Object> extension) {
        extensions.add(extension);
        return this;
    }

    public void annotate(ValidationOutcome outcome) {
        this.validationResults = new ArrayList<>(outcome.results());
    }

    /**
     * Structural copy: nested maps and lists are copied, leaf values are shared
     * (strings, numbers and booleans are immutable).
     */
    public Resource deepCopy() {
        Resource copy = new Resource(resourceType, id);
        copy.fields = copyMap(fields);
        List<Map<String, Object>> ext = new ArrayList<>(extensions.size());
        for (Map<String, Object> e : extensions) {
            ext.add(copyMap(e));
        }
        copy.extensions = ext;
        if (validationResults != null) {
            List<Map<String, Object>> results = new ArrayList<>(validationResults.size());
            for (Map<String, Object> r : validationResults) {
                results.add(copyMap(r));
            }
            copy.validationResults = results;
        }
        return copy;
    }

    private static Map<String, Object> copyMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), copyValue(v)));
        return copy;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(copyValue(item));
            }
            return copy;
        }
        return value;
    }
}

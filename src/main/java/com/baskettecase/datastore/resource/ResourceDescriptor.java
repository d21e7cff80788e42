package com.baskettecase.datastore.resource;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Description of a resource as returned by the platform, plus the datastore flag.
 *
 * Instances are immutable. {@link #withDatastoreActive(boolean)} returns a copy, leaving the id and
 * every other field as they were. Serialises to a flat JSON object.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ResourceDescriptor {

    private final String id;
    private final Map<String, Object> fields;
    private final Boolean datastoreActive;

    public ResourceDescriptor(String id, Map<String, Object> fields) {
        this(id, fields, null);
    }

    private ResourceDescriptor(String id, Map<String, Object> fields, Boolean datastoreActive) {
        this.id = Objects.requireNonNull(id, "id");
        this.fields = fields == null ? Map.of() : copyWithoutReserved(fields);
        this.datastoreActive = datastoreActive;
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    /**
     * Every field other than id and datastoreActive
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return fields;
    }

    /**
     * Null until the descriptor has been through {@link ActiveFlagResolver}
     */
    @JsonProperty("datastore_active")
    public Boolean getDatastoreActive() {
        return datastoreActive;
    }

    public ResourceDescriptor withDatastoreActive(boolean active) {
        return new ResourceDescriptor(id, fields, active);
    }

    private static Map<String, Object> copyWithoutReserved(Map<String, Object> fields) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.remove("id");
        copy.remove("datastore_active");
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceDescriptor that)) {
            return false;
        }
        return id.equals(that.id) && fields.equals(that.fields)
            && Objects.equals(datastoreActive, that.datastoreActive);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, fields, datastoreActive);
    }

    @Override
    public String toString() {
        return "ResourceDescriptor{id=" + id + ", fields=" + fields.keySet()
            + ", datastoreActive=" + datastoreActive + "}";
    }
}

package org.dxworks.uischema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "type", "required", "description", "defaultValue"})
public final class PropertyDefinition {
    private final String name;
    private final CanonicalType type;
    private final boolean required;
    private final String description;
    private final Object defaultValue;

    @JsonCreator
    public PropertyDefinition(@JsonProperty("name") String name,
                              @JsonProperty("type") CanonicalType type,
                              @JsonProperty("required") boolean required,
                              @JsonProperty("description") String description,
                              @JsonProperty("defaultValue") Object defaultValue) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = type == null ? CanonicalType.TEXT : type;
        this.required = required;
        this.description = description;
        this.defaultValue = defaultValue;
    }

    public PropertyDefinition(String name, CanonicalType type, boolean required) {
        this(name, type, required, null, null);
    }

    public String getName() {
        return name;
    }

    public CanonicalType getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    public String getDescription() {
        return description;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyDefinition)) return false;
        PropertyDefinition that = (PropertyDefinition) o;
        return required == that.required
                && name.equals(that.name)
                && type == that.type
                && Objects.equals(description, that.description)
                && Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, required, description, defaultValue);
    }

    @Override
    public String toString() {
        return name + ":" + type.getId() + (required ? "" : "?");
    }
}

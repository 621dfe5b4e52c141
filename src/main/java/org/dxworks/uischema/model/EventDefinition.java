package org.dxworks.uischema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "parameters", "description"})
public final class EventDefinition {
    private final String name;
    private final List<String> parameters;
    private final String description;

    @JsonCreator
    public EventDefinition(@JsonProperty("name") String name,
                           @JsonProperty("parameters") List<String> parameters,
                           @JsonProperty("description") String description) {
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.description = description;
    }

    public EventDefinition(String name, List<String> parameters) {
        this(name, parameters, null);
    }

    public String getName() {
        return name;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventDefinition)) return false;
        EventDefinition that = (EventDefinition) o;
        return name.equals(that.name)
                && parameters.equals(that.parameters)
                && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parameters, description);
    }

    @Override
    public String toString() {
        return name + parameters;
    }
}

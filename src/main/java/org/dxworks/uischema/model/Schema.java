package org.dxworks.uischema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.uischema.Platform;

import java.util.List;
import java.util.Objects;

/**
 * Normalized structural description of a UI component.
 * <p>
 * Instances are immutable. A schema with {@code degraded == true} is the fallback produced when
 * analysis could not complete; it carries no props or events.
 */
@JsonPropertyOrder({"name", "platform", "props", "events", "supportsChildren", "description", "degraded"})
public final class Schema {
    public static final String FALLBACK_DESCRIPTION = "fallback";

    private final String name;
    private final Platform platform;
    private final List<PropertyDefinition> props;
    private final List<EventDefinition> events;
    private final boolean supportsChildren;
    private final String description;
    private final boolean degraded;

    @JsonCreator
    public Schema(@JsonProperty("name") String name,
                  @JsonProperty("platform") Platform platform,
                  @JsonProperty("props") List<PropertyDefinition> props,
                  @JsonProperty("events") List<EventDefinition> events,
                  @JsonProperty("supportsChildren") boolean supportsChildren,
                  @JsonProperty("description") String description,
                  @JsonProperty("degraded") boolean degraded) {
        this.name = name == null ? "" : name;
        this.platform = platform == null ? Platform.UNIVERSAL : platform;
        this.props = props == null ? List.of() : List.copyOf(props);
        this.events = events == null ? List.of() : List.copyOf(events);
        this.supportsChildren = supportsChildren;
        this.description = description == null ? "" : description;
        this.degraded = degraded;
    }

    public static Schema fallback(String name) {
        return new Schema(name, Platform.UNIVERSAL, List.of(), List.of(), false, FALLBACK_DESCRIPTION, true);
    }

    public String getName() {
        return name;
    }

    public Platform getPlatform() {
        return platform;
    }

    public List<PropertyDefinition> getProps() {
        return props;
    }

    public List<EventDefinition> getEvents() {
        return events;
    }

    public boolean isSupportsChildren() {
        return supportsChildren;
    }

    public String getDescription() {
        return description;
    }

    public boolean isDegraded() {
        return degraded;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Schema)) return false;
        Schema schema = (Schema) o;
        return supportsChildren == schema.supportsChildren
                && degraded == schema.degraded
                && name.equals(schema.name)
                && platform == schema.platform
                && props.equals(schema.props)
                && events.equals(schema.events)
                && description.equals(schema.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, platform, props, events, supportsChildren, description, degraded);
    }

    @Override
    public String toString() {
        return "Schema{" + name + ", " + platform + ", props=" + props + ", events=" + events
                + ", supportsChildren=" + supportsChildren + (degraded ? ", degraded" : "") + "}";
    }
}

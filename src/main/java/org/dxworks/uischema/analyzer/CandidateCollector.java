package org.dxworks.uischema.analyzer;

import org.dxworks.uischema.model.CandidateOrigin;
import org.dxworks.uischema.model.EventCandidate;
import org.dxworks.uischema.model.PropertyCandidate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Call-scoped buffer of property and event candidates.
 * <p>
 * Every property goes through {@link EventClassifier} first: an event-shaped name is recorded as an event and
 * never reaches the property list.
 */
public class CandidateCollector {
    private final List<PropertyCandidate> properties = new ArrayList<>();
    private final List<EventCandidate> events = new ArrayList<>();

    public void addProperty(String name, String rawType, boolean required, CandidateOrigin origin, Object defaultValue) {
        if (name == null || name.isBlank()) return;

        if (EventClassifier.isEventName(name)) {
            addEvent(name, List.of(), origin);
            return;
        }
        properties.add(new PropertyCandidate(name, rawType, TypeMapper.map(rawType), required, origin, defaultValue));
    }

    public void addEvent(String name, List<String> parameterHints, CandidateOrigin origin) {
        if (name == null || name.isBlank()) return;
        events.add(new EventCandidate(EventClassifier.normalize(name), parameterHints, origin));
    }

    public List<PropertyCandidate> getProperties() {
        return Collections.unmodifiableList(properties);
    }

    public List<EventCandidate> getEvents() {
        return Collections.unmodifiableList(events);
    }
}

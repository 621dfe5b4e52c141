package org.dxworks.uischema.analyzer;

import org.dxworks.uischema.model.EventCandidate;
import org.dxworks.uischema.model.EventDefinition;
import org.dxworks.uischema.model.PropertyCandidate;
import org.dxworks.uischema.model.PropertyDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses candidates sharing a name. The candidate from the highest-precedence origin is kept whole; the
 * others neither upgrade nor downgrade it. Names keep the position of their first occurrence.
 */
public final class CandidateMerger {

    private CandidateMerger() {
        // utility class
    }

    public static List<PropertyDefinition> mergeProperties(List<PropertyCandidate> candidates) {
        Map<String, PropertyCandidate> byName = new LinkedHashMap<>();
        for (PropertyCandidate candidate : candidates) {
            PropertyCandidate kept = byName.get(candidate.name);
            if (kept == null || candidate.origin.outranks(kept.origin)) {
                byName.put(candidate.name, candidate);
            }
        }

        List<PropertyDefinition> result = new ArrayList<>(byName.size());
        for (PropertyCandidate c : byName.values()) {
            result.add(new PropertyDefinition(c.name, c.canonicalType, c.required, null, c.defaultValue));
        }
        return result;
    }

    public static List<EventDefinition> mergeEvents(List<EventCandidate> candidates) {
        Map<String, EventCandidate> byName = new LinkedHashMap<>();
        for (EventCandidate candidate : candidates) {
            EventCandidate kept = byName.get(candidate.name);
            if (kept == null || candidate.origin.outranks(kept.origin)) {
                byName.put(candidate.name, candidate);
            }
        }

        List<EventDefinition> result = new ArrayList<>(byName.size());
        for (EventCandidate c : byName.values()) {
            result.add(new EventDefinition(c.name, c.parameterHints));
        }
        return result;
    }
}

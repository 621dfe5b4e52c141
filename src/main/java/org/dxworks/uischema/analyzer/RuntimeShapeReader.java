package org.dxworks.uischema.analyzer;

import org.dxworks.uischema.Platform;
import org.dxworks.uischema.model.CandidateOrigin;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Candidates from a runtime component descriptor: the metadata a framework attaches to a component object
 * ({@code propTypes}/{@code defaultProps}, {@code props}/{@code emits}, {@code inputs}/{@code outputs}).
 */
public final class RuntimeShapeReader {
    private static final CandidateOrigin ORIGIN = CandidateOrigin.RUNTIME_METADATA;

    private RuntimeShapeReader() {
        // utility class
    }

    public static void read(Platform platform, Map<String, ?> shape, CandidateCollector collector) {
        switch (platform) {
            case REACT, REACT_NATIVE -> readReact(shape, collector);
            case VUE -> readVue(shape, collector);
            case ANGULAR -> readAngular(shape, collector);
            case SVELTE -> readSvelte(shape, collector);
            default -> {
                // universal and vanilla shapes carry no declared props
            }
        }
    }

    private static void readReact(Map<?, ?> shape, CandidateCollector collector) {
        Map<?, ?> propTypes = asMap(shape.get("propTypes"));
        Map<?, ?> defaultProps = asMap(shape.get("defaultProps"));

        for (Map.Entry<?, ?> entry : propTypes.entrySet()) {
            String name = keyOf(entry);
            Object declared = entry.getValue();
            String rawType;
            boolean required = false;
            if (declared instanceof Map) {
                Map<?, ?> declaredMap = asMap(declared);
                rawType = stringOrNull(declaredMap.get("type"));
                required = Boolean.TRUE.equals(declaredMap.get("isRequired"));
            } else {
                rawType = stringOrNull(declared);
            }
            collector.addProperty(name, rawType, required, ORIGIN, defaultProps.get(name));
        }

        for (Map.Entry<?, ?> entry : defaultProps.entrySet()) {
            if (!propTypes.containsKey(keyOf(entry))) {
                collector.addProperty(keyOf(entry), null, false, ORIGIN, entry.getValue());
            }
        }
    }

    private static void readVue(Map<?, ?> shape, CandidateCollector collector) {
        Object props = shape.get("props");
        if (props instanceof List) {
            for (Object name : (List<?>) props) {
                collector.addProperty(stringOrNull(name), null, false, ORIGIN, null);
            }
        } else {
            for (Map.Entry<?, ?> entry : asMap(props).entrySet()) {
                Object declared = entry.getValue();
                if (declared instanceof Map) {
                    Map<?, ?> declaredMap = asMap(declared);
                    collector.addProperty(keyOf(entry), stringOrNull(declaredMap.get("type")),
                            Boolean.TRUE.equals(declaredMap.get("required")), ORIGIN, declaredMap.get("default"));
                } else {
                    collector.addProperty(keyOf(entry), stringOrNull(declared), false, ORIGIN, null);
                }
            }
        }

        Object emits = shape.get("emits");
        if (emits instanceof List) {
            for (Object name : (List<?>) emits) {
                addEvent(stringOrNull(name), List.of(), collector);
            }
        } else {
            for (Map.Entry<?, ?> entry : asMap(emits).entrySet()) {
                addEvent(keyOf(entry), asStringList(entry.getValue()), collector);
            }
        }
    }

    private static void readAngular(Map<?, ?> shape, CandidateCollector collector) {
        for (String input : asStringList(shape.get("inputs"))) {
            collector.addProperty(input, null, false, ORIGIN, null);
        }
        for (String output : asStringList(shape.get("outputs"))) {
            addEvent(output, List.of(), collector);
        }
    }

    private static void readSvelte(Map<?, ?> shape, CandidateCollector collector) {
        for (Map.Entry<?, ?> entry : asMap(shape.get("props")).entrySet()) {
            Map<?, ?> declared = asMap(entry.getValue());
            boolean hasDefault = declared.containsKey("default");
            collector.addProperty(keyOf(entry), stringOrNull(declared.get("type")), !hasDefault, ORIGIN,
                    declared.get("default"));
        }
    }

    private static void addEvent(String name, List<String> parameters, CandidateCollector collector) {
        if (name == null || name.isBlank()) return;
        collector.addEvent(EventClassifier.canonicalize(name), parameters, ORIGIN);
    }

    private static String keyOf(Map.Entry<?, ?> entry) {
        return String.valueOf(entry.getKey());
    }

    private static Map<?, ?> asMap(Object value) {
        return value instanceof Map ? (Map<?, ?>) value : Map.of();
    }

    private static List<String> asStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                String s = stringOrNull(item);
                if (s != null) result.add(s);
            }
        }
        return result;
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }
}

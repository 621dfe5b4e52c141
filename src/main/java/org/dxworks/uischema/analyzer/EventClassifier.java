package org.dxworks.uischema.analyzer;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Naming-convention based split between properties and events.
 * <p>
 * Ecosystem spellings are rewritten to the canonical {@code on}+Name form before the test:
 * {@code @click}, {@code on:click}, {@code v-on:click} and {@code (click)} all become {@code onClick}.
 */
public final class EventClassifier {

    private static final Pattern EVENT_NAME = Pattern.compile("^on[A-Z]");
    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("[-:.]");

    private EventClassifier() {
        // utility class
    }

    public static boolean isEventName(String name) {
        if (name == null) return false;
        return EVENT_NAME.matcher(normalize(name)).find();
    }

    /**
     * Rewrites colon-, at- and parenthesis-delimited event attribute spellings into {@code onName}.
     * Names in any other form are returned unchanged.
     */
    public static String normalize(String name) {
        if (name == null) return null;
        String trimmed = name.trim();

        String eventPart = null;
        if (trimmed.startsWith("v-on:")) {
            eventPart = trimmed.substring("v-on:".length());
        } else if (trimmed.startsWith("on:")) {
            eventPart = trimmed.substring("on:".length());
        } else if (trimmed.startsWith("@")) {
            eventPart = trimmed.substring(1);
        } else if (trimmed.length() > 2 && trimmed.startsWith("(") && trimmed.endsWith(")")) {
            eventPart = trimmed.substring(1, trimmed.length() - 1);
        }

        if (eventPart == null || eventPart.isBlank()) return trimmed;
        return "on" + joinCapitalized(eventPart);
    }

    /**
     * Canonical event name for a bare event name declared by runtime metadata ({@code change -> onChange}).
     */
    public static String canonicalize(String name) {
        if (name == null || name.isBlank()) return name;
        String normalized = normalize(name);
        if (EVENT_NAME.matcher(normalized).find()) return normalized;
        return "on" + joinCapitalized(normalized);
    }

    private static String joinCapitalized(String eventPart) {
        StringBuilder sb = new StringBuilder();
        for (String segment : SEGMENT_SEPARATOR.split(eventPart)) {
            if (segment.isEmpty()) continue;
            sb.append(segment.substring(0, 1).toUpperCase(Locale.ROOT)).append(segment.substring(1));
        }
        return sb.toString();
    }
}

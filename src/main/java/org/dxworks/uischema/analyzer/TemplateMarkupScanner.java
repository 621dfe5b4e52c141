package org.dxworks.uischema.analyzer;

import org.dxworks.uischema.model.CandidateOrigin;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex scan of single-file component templates ({@code .vue}, {@code .svelte}), which no bundled grammar parses.
 * <p>
 * Start tags contribute event attributes ({@code @click.prevent}, {@code v-on:input}, {@code on:click|once}) with
 * their modifiers dropped. An element with text or nested elements between its tags sets the children flag.
 */
final class TemplateMarkupScanner {

    private static final String ATTRIBUTE_VALUE = "(?:\"[^\"]*\"|'[^']*'|\\{[^}]*\\}|[^\\s>]+)";

    private static final Pattern COMMENT = Pattern.compile("(?s)<!--.*?-->");

    // <name attr="v" @click.prevent="go" on:click={go} disabled /> or without the slash
    private static final Pattern START_TAG = Pattern.compile(
        "<([A-Za-z][\\w.:-]*)((?:\\s+[^\\s=>/]+(?:\\s*=\\s*" + ATTRIBUTE_VALUE + ")?)*)\\s*(/?)>"
    );

    private static final Pattern ATTRIBUTE = Pattern.compile(
        "([^\\s=>/]+)(?:\\s*=\\s*" + ATTRIBUTE_VALUE + ")?"
    );

    private static final Set<String> VOID_ELEMENTS = Set.of("area", "base", "br", "col", "embed", "hr", "img",
            "input", "link", "meta", "source", "track", "wbr");

    private TemplateMarkupScanner() {
        // utility class
    }

    static void scan(String markup, WalkContext context) {
        if (markup == null || markup.isBlank()) return;

        String text = COMMENT.matcher(markup).replaceAll("");
        Matcher tag = START_TAG.matcher(text);
        while (tag.find()) {
            String element = tag.group(1).toLowerCase(Locale.ROOT);
            extractEvents(tag.group(2), context);

            boolean selfClosing = !tag.group(3).isEmpty();
            if (!selfClosing && !"template".equals(element) && !VOID_ELEMENTS.contains(element)
                    && hasContent(text, tag.end())) {
                context.markMarkupWithChildren();
            }
        }
    }

    private static void extractEvents(String attributes, WalkContext context) {
        if (attributes == null || attributes.isBlank()) return;

        Matcher attribute = ATTRIBUTE.matcher(attributes);
        while (attribute.find()) {
            String name = withoutModifiers(attribute.group(1));
            if (EventClassifier.isEventName(name)) {
                context.addEvent(name, List.of(), CandidateOrigin.MARKUP_ATTRIBUTE);
            }
        }
    }

    /**
     * {@code @keyup.enter} becomes {@code @keyup}, {@code on:click|preventDefault} becomes {@code on:click}.
     */
    static String withoutModifiers(String name) {
        int pipe = name.indexOf('|');
        String result = pipe < 0 ? name : name.substring(0, pipe);

        int prefix = result.startsWith("@") ? 1 : result.startsWith("v-on:") ? "v-on:".length() : -1;
        if (prefix >= 0) {
            int dot = result.indexOf('.', prefix);
            if (dot >= 0) result = result.substring(0, dot);
        }
        return result;
    }

    private static boolean hasContent(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
        return i < text.length() && !text.startsWith("</", i);
    }
}

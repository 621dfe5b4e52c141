package org.dxworks.uischema.analyzer;

import org.dxworks.uischema.model.CanonicalType;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes raw type annotation text into a {@link CanonicalType}.
 *
 * <h3>Priority (first match wins, case-insensitive):</h3>
 * <ol>
 *   <li><b>text</b> - blank or missing annotation</li>
 *   <li><b>function</b> - an arrow at the outermost level, {@code (..) => ..}</li>
 *   <li><b>array</b> - ends in {@code []} or starts with {@code Array<}, so {@code Function[]} is an array</li>
 *   <li><b>function</b> - {@code function}, {@code func}, {@code ...Handler}, a parenthesized arrow</li>
 *   <li><b>array</b> - {@code []} or {@code array} anywhere (checked before element types so {@code string[]} is not text)</li>
 *   <li><b>element</b> - {@code ReactNode}, {@code ReactElement}, {@code JSX.Element}, {@code element}, the word {@code node}</li>
 *   <li><b>resource</b> - {@code ImageSource...}, {@code resource}</li>
 *   <li><b>color</b> - {@code color}</li>
 *   <li><b>dimension</b> - {@code dimension}</li>
 *   <li><b>object</b> - object literal types, {@code Record<..>}, {@code object}, {@code style}, {@code shape}</li>
 *   <li><b>text</b> - {@code string}</li>
 *   <li><b>number</b> - {@code number}</li>
 *   <li><b>boolean</b> - {@code boolean}, {@code bool}</li>
 *   <li><b>text</b> - fallback</li>
 * </ol>
 */
public final class TypeMapper {
    private static final Pattern NODE_WORD = Pattern.compile("\\bnode\\b");

    private TypeMapper() {
        // utility class
    }

    public static CanonicalType map(String rawType) {
        if (rawType == null || rawType.isBlank()) return CanonicalType.TEXT;

        String lower = rawType.trim().toLowerCase(Locale.ROOT);

        if (hasOutermostArrow(lower)) {
            return CanonicalType.FUNCTION;
        }

        if (lower.endsWith("[]") || lower.startsWith("array<") || lower.startsWith("readonlyarray<")) {
            return CanonicalType.ARRAY;
        }

        if ((lower.startsWith("(") && lower.contains("=>"))
                || lower.contains("function") || lower.contains("func")
                || lower.endsWith("handler")) {
            return CanonicalType.FUNCTION;
        }

        if (lower.contains("[]") || lower.contains("array")) {
            return CanonicalType.ARRAY;
        }

        if (lower.contains("reactnode") || lower.contains("reactelement") || lower.contains("jsx.element")
                || lower.contains("element") || NODE_WORD.matcher(lower).find()) {
            return CanonicalType.ELEMENT;
        }

        if (lower.contains("imagesource") || lower.contains("resource")) {
            return CanonicalType.RESOURCE;
        }

        if (lower.contains("color")) {
            return CanonicalType.COLOR;
        }

        if (lower.contains("dimension")) {
            return CanonicalType.DIMENSION;
        }

        if (lower.startsWith("{") || lower.contains("record<") || lower.contains("object")
                || lower.contains("style") || lower.contains("shape")) {
            return CanonicalType.OBJECT;
        }

        if (lower.contains("string")) return CanonicalType.TEXT;
        if (lower.contains("number")) return CanonicalType.NUMBER;
        if (lower.contains("boolean") || lower.contains("bool")) return CanonicalType.BOOLEAN;

        return CanonicalType.TEXT;
    }

    /**
     * {@code () => string[]} has its arrow outside any bracket; {@code (() => void)[]} does not.
     */
    private static boolean hasOutermostArrow(String type) {
        int depth = 0;
        for (int i = 0; i < type.length(); i++) {
            char c = type.charAt(i);
            if (c == '(' || c == '[' || c == '<' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}' || c == '>' && !isArrowAt(type, i - 1)) {
                depth = Math.max(0, depth - 1);
            } else if (c == '=' && depth == 0 && isArrowAt(type, i)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isArrowAt(String type, int index) {
        return index >= 0 && index + 1 < type.length() && type.charAt(index) == '=' && type.charAt(index + 1) == '>';
    }
}

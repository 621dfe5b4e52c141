package org.dxworks.uischema.analyzer.extractor;

import org.dxworks.uischema.analyzer.WalkContext;
import org.treesitter.TSNode;

import static org.dxworks.uischema.analyzer.TreeSitterHelper.isAbsent;
import static org.dxworks.uischema.analyzer.TreeSitterHelper.unquote;

/**
 * Literal default values of destructured props. Non-literal expressions are kept as source text.
 */
final class DefaultValues {

    private DefaultValues() {
        // utility class
    }

    static Object of(TSNode expression, WalkContext context) {
        if (isAbsent(expression)) return null;
        String text = context.text(expression);
        if (text == null) return null;
        text = text.trim();

        switch (expression.getType()) {
            case "string":
                return unquote(text);
            case "template_string":
                return text.contains("${") ? text : unquote(text);
            case "true":
                return Boolean.TRUE;
            case "false":
                return Boolean.FALSE;
            case "null":
            case "undefined":
                return null;
            case "number":
            case "unary_expression":
                return parseNumber(text);
            default:
                return text;
        }
    }

    private static Object parseNumber(String text) {
        try {
            long value = Long.parseLong(text);
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return (int) value;
            }
            return value;
        } catch (NumberFormatException notAnInteger) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException notANumber) {
                return text;
            }
        }
    }
}

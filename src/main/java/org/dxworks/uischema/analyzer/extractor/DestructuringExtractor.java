package org.dxworks.uischema.analyzer.extractor;

import org.dxworks.uischema.analyzer.NodeExtractor;
import org.dxworks.uischema.analyzer.WalkContext;
import org.dxworks.uischema.model.CandidateOrigin;
import org.treesitter.TSNode;

import java.util.List;
import java.util.Set;

import static org.dxworks.uischema.analyzer.TreeSitterHelper.*;

/**
 * Property candidates from functions whose first parameter destructures an object:
 * {@code function Button({ text, onClick })}, {@code const Card = ({ title, ...rest }) => ...}.
 * <p>
 * Only functions that can be a component are read: declarations, values bound to a name or exported, and the
 * argument of a {@code memo(..)} or {@code forwardRef(..)} wrapper. Callbacks passed to other calls or written
 * inside markup are skipped. The destructuring carries no type information, so every candidate has an unknown
 * raw type.
 */
public class DestructuringExtractor implements NodeExtractor {
    private static final String NT_OBJECT_PATTERN = "object_pattern";
    private static final String NT_SHORTHAND = "shorthand_property_identifier_pattern";
    private static final String NT_PAIR_PATTERN = "pair_pattern";
    private static final String NT_OBJECT_ASSIGNMENT = "object_assignment_pattern";
    private static final String NT_ASSIGNMENT_PATTERN = "assignment_pattern";
    private static final String NT_REST_PATTERN = "rest_pattern";
    private static final Set<String> DECLARATIONS = Set.of("function_declaration", "generator_function_declaration");
    private static final Set<String> BINDING_PARENTS = Set.of("variable_declarator", "export_statement",
            "assignment_expression", "public_field_definition");
    private static final List<String> COMPONENT_WRAPPERS = List.of("memo", "forwardRef");

    @Override
    public Set<String> nodeTypes() {
        return Set.of("function_declaration", "generator_function_declaration", "function_expression",
                "function", "generator_function", "arrow_function");
    }

    @Override
    public void extract(TSNode node, WalkContext context) {
        if (!isComponentLevel(node, context)) return;

        TSNode params = getChildByFieldName(node, "parameters");
        if (params == null) return;

        TSNode firstParam = null;
        for (int i = 0; i < params.getNamedChildCount(); i++) {
            TSNode candidate = params.getNamedChild(i);
            if (!isAbsent(candidate) && !"comment".equals(candidate.getType())) {
                firstParam = candidate;
                break;
            }
        }

        TSNode pattern = objectPatternOf(firstParam);
        if (pattern == null) return;

        for (int i = 0; i < pattern.getNamedChildCount(); i++) {
            TSNode element = pattern.getNamedChild(i);
            if (isAbsent(element)) continue;

            switch (element.getType()) {
                case NT_SHORTHAND -> addBinding(context.text(element), true, null, context);
                case NT_PAIR_PATTERN -> {
                    TSNode key = getChildByFieldName(element, "key");
                    TSNode value = getChildByFieldName(element, "value");
                    Object defaultValue = null;
                    if (isNodeTypeOneOf(value, NT_ASSIGNMENT_PATTERN)) {
                        defaultValue = DefaultValues.of(getChildByFieldName(value, "right"), context);
                    }
                    addBinding(key == null ? null : unquote(context.text(key)), true, defaultValue, context);
                }
                case NT_OBJECT_ASSIGNMENT -> {
                    TSNode left = getChildByFieldName(element, "left");
                    if (isNodeTypeOneOf(left, NT_SHORTHAND)) {
                        Object defaultValue = DefaultValues.of(getChildByFieldName(element, "right"), context);
                        addBinding(context.text(left), true, defaultValue, context);
                    }
                }
                case NT_REST_PATTERN -> {
                    if (element.getNamedChildCount() > 0) {
                        addBinding(context.text(element.getNamedChild(0)), false, null, context);
                    }
                }
                default -> {
                    // comments and nested patterns bind no top-level prop name
                }
            }
        }
    }

    private static boolean isComponentLevel(TSNode function, WalkContext context) {
        if (DECLARATIONS.contains(function.getType())) return true;

        TSNode parent = parentSkippingParentheses(function);
        if (parent == null) return false;
        if (BINDING_PARENTS.contains(parent.getType())) return true;
        if (!"arguments".equals(parent.getType())) return false;

        TSNode call = parent.getParent();
        if (!isNodeTypeOneOf(call, "call_expression")) return false;
        String callee = context.text(getChildByFieldName(call, "function"));
        if (callee == null) return false;
        String trimmed = callee.trim();
        return COMPONENT_WRAPPERS.stream().anyMatch(wrapper -> trimmed.equals(wrapper) || trimmed.endsWith("." + wrapper));
    }

    private static TSNode parentSkippingParentheses(TSNode node) {
        TSNode parent = node.getParent();
        while (!isAbsent(parent) && "parenthesized_expression".equals(parent.getType())) {
            parent = parent.getParent();
        }
        return isAbsent(parent) ? null : parent;
    }

    private static void addBinding(String name, boolean required, Object defaultValue, WalkContext context) {
        if (name == null) return;
        context.addProperty(name.trim(), null, required, CandidateOrigin.DESTRUCTURE, defaultValue);
    }

    private static TSNode objectPatternOf(TSNode param) {
        if (isAbsent(param)) return null;
        String type = param.getType();
        if (NT_OBJECT_PATTERN.equals(type)) return param;
        if (isTypeOneOf(type, "required_parameter", "optional_parameter")) {
            return objectPatternOf(getChildByFieldName(param, "pattern"));
        }
        if (NT_ASSIGNMENT_PATTERN.equals(type)) {
            return objectPatternOf(getChildByFieldName(param, "left"));
        }
        return null;
    }
}

package org.dxworks.uischema.analyzer.extractor;

import org.dxworks.uischema.analyzer.EventClassifier;
import org.dxworks.uischema.analyzer.NodeExtractor;
import org.dxworks.uischema.analyzer.WalkContext;
import org.dxworks.uischema.model.CandidateOrigin;
import org.treesitter.TSNode;

import java.util.Set;

import static org.dxworks.uischema.analyzer.TreeSitterHelper.*;

/**
 * Property and event candidates from interface declarations and from type aliases with an object-literal body.
 */
public class DeclarationExtractor implements NodeExtractor {
    private static final String NT_INTERFACE = "interface_declaration";
    private static final String NT_TYPE_ALIAS = "type_alias_declaration";
    private static final String NT_OBJECT_TYPE = "object_type";
    private static final String NT_INTERFACE_BODY = "interface_body";
    private static final String NT_PROPERTY_SIGNATURE = "property_signature";
    private static final String NT_METHOD_SIGNATURE = "method_signature";

    private static final String RAW_FUNCTION_TYPE = "function";

    @Override
    public Set<String> nodeTypes() {
        return Set.of(NT_INTERFACE, NT_TYPE_ALIAS);
    }

    @Override
    public void extract(TSNode node, WalkContext context) {
        CandidateOrigin origin;
        TSNode body;
        if (NT_INTERFACE.equals(node.getType())) {
            origin = CandidateOrigin.INTERFACE;
            body = getChildByFieldName(node, "body");
            if (body == null) {
                body = getFirstChildOfTypes(node, NT_INTERFACE_BODY, NT_OBJECT_TYPE);
            }
        } else {
            origin = CandidateOrigin.TYPE_ALIAS;
            body = getChildByFieldName(node, "value");
            // Only object-literal aliases describe props; unions, primitives and references are skipped
            if (!isNodeTypeOneOf(body, NT_OBJECT_TYPE)) return;
        }
        if (body == null) return;

        for (int i = 0; i < body.getNamedChildCount(); i++) {
            TSNode member = body.getNamedChild(i);
            if (isAbsent(member)) continue;

            if (NT_PROPERTY_SIGNATURE.equals(member.getType())) {
                extractPropertySignature(member, origin, context);
            } else if (NT_METHOD_SIGNATURE.equals(member.getType())) {
                extractMethodSignature(member, origin, context);
            }
        }
    }

    private void extractPropertySignature(TSNode member, CandidateOrigin origin, WalkContext context) {
        String name = memberName(member, context);
        if (name == null) return;

        boolean optional = hasTokenChild(member, "?");
        TSNode typeAnnotation = getChildByFieldName(member, "type");

        if (EventClassifier.isEventName(name)) {
            context.addEvent(name, ParameterNames.of(typeAnnotation, context), origin);
            return;
        }
        context.addProperty(name, annotatedType(typeAnnotation, context), !optional, origin, null);
    }

    private void extractMethodSignature(TSNode member, CandidateOrigin origin, WalkContext context) {
        String name = memberName(member, context);
        if (name == null) return;

        if (EventClassifier.isEventName(name)) {
            context.addEvent(name, ParameterNames.of(getChildByFieldName(member, "parameters"), context), origin);
            return;
        }
        context.addProperty(name, RAW_FUNCTION_TYPE, !hasTokenChild(member, "?"), origin, null);
    }

    private static String memberName(TSNode member, WalkContext context) {
        TSNode nameNode = getChildByFieldName(member, "name");
        if (nameNode == null) return null;
        return unquote(context.text(nameNode));
    }

    private static String annotatedType(TSNode typeAnnotation, WalkContext context) {
        if (typeAnnotation == null) return null;
        if (typeAnnotation.getNamedChildCount() > 0) {
            return normalizeInline(context.text(typeAnnotation.getNamedChild(0)));
        }
        String text = context.text(typeAnnotation);
        return text == null ? null : normalizeInline(text.replaceFirst("^\\s*:", ""));
    }
}

package org.dxworks.uischema.analyzer.extractor;

import org.dxworks.uischema.analyzer.EventClassifier;
import org.dxworks.uischema.analyzer.NodeExtractor;
import org.dxworks.uischema.analyzer.WalkContext;
import org.dxworks.uischema.model.CandidateOrigin;
import org.treesitter.TSNode;

import java.util.List;
import java.util.Set;

import static org.dxworks.uischema.analyzer.TreeSitterHelper.*;

/**
 * Event candidates from markup attributes, plus detection of markup elements that have children.
 * <p>
 * Ordinary attributes are not property candidates: their value type cannot be inferred from markup alone.
 */
public class MarkupAttributeExtractor implements NodeExtractor {
    private static final String NT_ELEMENT = "jsx_element";
    private static final String NT_OPENING_ELEMENT = "jsx_opening_element";
    private static final String NT_SELF_CLOSING_ELEMENT = "jsx_self_closing_element";
    private static final String NT_CLOSING_ELEMENT = "jsx_closing_element";
    private static final String NT_ATTRIBUTE = "jsx_attribute";
    private static final String NT_TEXT = "jsx_text";

    @Override
    public Set<String> nodeTypes() {
        return Set.of(NT_ELEMENT, NT_OPENING_ELEMENT, NT_SELF_CLOSING_ELEMENT);
    }

    @Override
    public void extract(TSNode node, WalkContext context) {
        if (NT_ELEMENT.equals(node.getType())) {
            if (hasChildNodes(node, context)) {
                context.markMarkupWithChildren();
            }
            return;
        }

        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode attribute = node.getNamedChild(i);
            if (!isNodeTypeOneOf(attribute, NT_ATTRIBUTE) || attribute.getNamedChildCount() == 0) continue;

            String name = context.text(attribute.getNamedChild(0));
            if (EventClassifier.isEventName(name)) {
                context.addEvent(name, List.of(), CandidateOrigin.MARKUP_ATTRIBUTE);
            }
        }
    }

    private static boolean hasChildNodes(TSNode element, WalkContext context) {
        for (int i = 0; i < element.getNamedChildCount(); i++) {
            TSNode child = element.getNamedChild(i);
            if (isAbsent(child) || isNodeTypeOneOf(child, NT_OPENING_ELEMENT, NT_CLOSING_ELEMENT, "comment")) continue;
            if (NT_TEXT.equals(child.getType())) {
                String text = context.text(child);
                if (text == null || text.isBlank()) continue;
            }
            return true;
        }
        return false;
    }
}

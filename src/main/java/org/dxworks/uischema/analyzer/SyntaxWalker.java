package org.dxworks.uischema.analyzer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.uischema.analyzer.extractor.DeclarationExtractor;
import org.dxworks.uischema.analyzer.extractor.DestructuringExtractor;
import org.dxworks.uischema.analyzer.extractor.MarkupAttributeExtractor;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.dxworks.uischema.analyzer.TreeSitterHelper.isAbsent;
import static org.dxworks.uischema.analyzer.TreeSitterHelper.lineOf;

/**
 * Single depth-first pass over a parsed component that dispatches each node to the extractors registered for
 * its kind. Unregistered kinds are walked through without extraction.
 */
public class SyntaxWalker {
    private static final Logger logger = LogManager.getLogger(SyntaxWalker.class);

    private final Map<String, List<NodeExtractor>> extractorsByNodeType;

    public SyntaxWalker(List<? extends NodeExtractor> extractors) {
        Map<String, List<NodeExtractor>> byType = new HashMap<>();
        for (NodeExtractor extractor : extractors) {
            for (String nodeType : extractor.nodeTypes()) {
                byType.computeIfAbsent(nodeType, k -> new ArrayList<>()).add(extractor);
            }
        }
        byType.replaceAll((type, list) -> List.copyOf(list));
        this.extractorsByNodeType = Collections.unmodifiableMap(byType);
    }

    public static SyntaxWalker withDefaultExtractors() {
        return new SyntaxWalker(List.of(
                new DeclarationExtractor(),
                new DestructuringExtractor(),
                new MarkupAttributeExtractor()));
    }

    /**
     * Walks the primary tree, then the markup overlay when there is one. Both trees feed the same context;
     * candidates seen twice are collapsed by the merger.
     */
    public void walk(ParsedSource parsed, WalkContext context) {
        walkTree(parsed.getRoot(), context);
        if (parsed.getMarkupOverlay() != null) {
            walkTree(parsed.getMarkupOverlay().getRoot(), context);
        }

        if (!context.getFailures().isEmpty()) {
            logger.warn("Component {}: {} node(s) could not be extracted, schema may be incomplete",
                    context.getComponentName(), context.getFailures().size());
        }
    }

    private void walkTree(TSNode root, WalkContext context) {
        if (isAbsent(root)) return;

        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            TSNode node = stack.pop();

            List<NodeExtractor> extractors = extractorsByNodeType.get(node.getType());
            if (extractors != null) {
                for (NodeExtractor extractor : extractors) {
                    runExtractor(extractor, node, context);
                }
            }

            for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getNamedChild(i);
                if (!isAbsent(child)) {
                    stack.push(child);
                }
            }
        }
    }

    private static void runExtractor(NodeExtractor extractor, TSNode node, WalkContext context) {
        try {
            extractor.extract(node, context);
        } catch (RuntimeException e) {
            ExtractionFailureException failure = new ExtractionFailureException(node.getType(), lineOf(node), e);
            context.recordFailure(failure);
            logger.warn("Component {}: stage {} failed in {} on {} at line {}: {}",
                    context.getComponentName(), failure.getStage(), extractor.getClass().getSimpleName(),
                    failure.getNodeKind(), failure.getLine(), e.toString(), e);
        }
    }
}

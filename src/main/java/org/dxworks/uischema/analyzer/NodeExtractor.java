package org.dxworks.uischema.analyzer;

import org.treesitter.TSNode;

import java.util.Set;

/**
 * Extraction strategy for a set of syntax node kinds. Implementations must keep no state between calls;
 * everything they find goes into the {@link WalkContext}.
 */
public interface NodeExtractor {

    Set<String> nodeTypes();

    void extract(TSNode node, WalkContext context);
}

package org.dxworks.uischema.analyzer;

import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State of one syntax walk. Created per {@code analyze} call and discarded with it.
 */
public class WalkContext extends CandidateCollector {
    private final String componentName;
    private final ParsedSource parsed;
    private final List<ExtractionFailureException> failures = new ArrayList<>();
    private boolean markupWithChildren;

    public WalkContext(String componentName, ParsedSource parsed) {
        this.componentName = componentName;
        this.parsed = parsed;
    }

    public String getComponentName() {
        return componentName;
    }

    public String text(TSNode node) {
        return TreeSitterHelper.getNodeText(parsed.getSourceBytes(), node);
    }

    public void markMarkupWithChildren() {
        markupWithChildren = true;
    }

    public boolean hasMarkupWithChildren() {
        return markupWithChildren;
    }

    void recordFailure(ExtractionFailureException failure) {
        failures.add(failure);
    }

    public List<ExtractionFailureException> getFailures() {
        return Collections.unmodifiableList(failures);
    }
}

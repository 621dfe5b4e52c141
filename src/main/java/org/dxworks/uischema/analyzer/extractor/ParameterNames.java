package org.dxworks.uischema.analyzer.extractor;

import org.dxworks.uischema.analyzer.WalkContext;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.uischema.analyzer.TreeSitterHelper.*;

final class ParameterNames {

    private ParameterNames() {
        // utility class
    }

    /**
     * Names of the parameters of the first parameter list found under {@code scope}, in declaration order.
     */
    static List<String> of(TSNode scope, WalkContext context) {
        List<String> names = new ArrayList<>();
        if (isAbsent(scope)) return names;

        TSNode params = "formal_parameters".equals(scope.getType()) ? scope : findFirstDescendant(scope, "formal_parameters");
        if (params == null) return names;

        for (int i = 0; i < params.getNamedChildCount(); i++) {
            TSNode param = params.getNamedChild(i);
            if (isAbsent(param) || "comment".equals(param.getType())) continue;

            TSNode pattern = param;
            if (isNodeTypeOneOf(param, "required_parameter", "optional_parameter")) {
                TSNode byField = getChildByFieldName(param, "pattern");
                if (byField != null) pattern = byField;
            }
            if (isNodeTypeOneOf(pattern, "rest_pattern") && pattern.getNamedChildCount() > 0) {
                pattern = pattern.getNamedChild(0);
            }
            if (isNodeTypeOneOf(pattern, "assignment_pattern")) {
                TSNode left = getChildByFieldName(pattern, "left");
                if (left != null) pattern = left;
            }
            String name = context.text(pattern);
            if (name != null && !name.isBlank()) names.add(name.trim());
        }
        return names;
    }
}

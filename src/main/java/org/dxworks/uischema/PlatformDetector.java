package org.dxworks.uischema;

import java.util.List;
import java.util.Map;

/**
 * Heuristic detection of the UI platform a component was written for.
 * <p>
 * Rules are evaluated in a fixed order and the first match wins; there is no scoring, so a source showing
 * signals of two platforms always resolves to the earlier one.
 *
 * <h3>Source text priority ({@link #detect(String)}):</h3>
 * <ol>
 *   <li><b>react-native</b> - native view primitives ({@code <View}, {@code StyleSheet.create}, {@code Platform.OS}, ...)</li>
 *   <li><b>react</b> - state/effect hooks, {@code React.FC}, {@code React.Component}, imports from {@code react}</li>
 *   <li><b>vue</b> - {@code defineComponent}, {@code defineProps}, {@code setup()}, imports from {@code vue}, {@code <template>}</li>
 *   <li><b>angular</b> - {@code @Component}, {@code @Input}, {@code @Output}, {@code @NgModule} decorators</li>
 *   <li><b>svelte</b> - {@code $:} reactive statements, {@code {#if}}/{@code {#each}} blocks, {@code $$render}</li>
 *   <li><b>vanilla</b> - direct DOM construction and custom elements</li>
 *   <li><b>universal</b> - fallback</li>
 * </ol>
 *
 * <h3>Runtime shape priority ({@link #detect(Map)}):</h3>
 * <ol>
 *   <li><b>react</b> - element-type marker {@code $$typeof}</li>
 *   <li><b>vue</b> - {@code render}, {@code template} or {@code setup}</li>
 *   <li><b>angular</b> - {@code selector} or {@code templateUrl}</li>
 *   <li><b>svelte</b> - {@code $$render} or {@code fragment}</li>
 *   <li><b>universal</b> - fallback</li>
 * </ol>
 */
public final class PlatformDetector {

    private static final List<Rule> SOURCE_RULES = List.of(
            new Rule(Platform.REACT_NATIVE, "'react-native'", "\"react-native\"", "StyleSheet.create",
                    "TouchableOpacity", "Platform.OS", "<View", "<ScrollView", "<TextInput"),
            new Rule(Platform.REACT, "useState", "useEffect", "useReducer", "React.FC", "React.Component",
                    "JSX.Element", "from 'react'", "from \"react\""),
            new Rule(Platform.VUE, "defineComponent", "defineProps", "Vue.component", "setup()",
                    "from 'vue'", "from \"vue\"", "<template>"),
            new Rule(Platform.ANGULAR, "@Component", "@Input", "@Output", "@NgModule", "@angular/core"),
            new Rule(Platform.SVELTE, "$:", "{#if", "{#each", "$$render", "createEventDispatcher",
                    "from 'svelte'", "from \"svelte\""),
            new Rule(Platform.VANILLA, "document.createElement", "customElements.define", "extends HTMLElement",
                    "addEventListener")
    );

    private static final List<Rule> RUNTIME_RULES = List.of(
            new Rule(Platform.REACT, "$$typeof"),
            new Rule(Platform.VUE, "render", "template", "setup"),
            new Rule(Platform.ANGULAR, "selector", "templateUrl"),
            new Rule(Platform.SVELTE, "$$render", "fragment")
    );

    private PlatformDetector() {
        // utility class
    }

    public static Platform detect(String source) {
        if (source == null || source.isBlank()) return Platform.UNIVERSAL;

        for (Rule rule : SOURCE_RULES) {
            for (String marker : rule.markers) {
                if (source.contains(marker)) {
                    return rule.platform;
                }
            }
        }
        return Platform.UNIVERSAL;
    }

    public static Platform detect(Map<String, ?> runtimeShape) {
        if (runtimeShape == null || runtimeShape.isEmpty()) return Platform.UNIVERSAL;

        for (Rule rule : RUNTIME_RULES) {
            for (String field : rule.markers) {
                if (runtimeShape.get(field) != null) {
                    return rule.platform;
                }
            }
        }
        return Platform.UNIVERSAL;
    }

    private static final class Rule {
        private final Platform platform;
        private final List<String> markers;

        private Rule(Platform platform, String... markers) {
            this.platform = platform;
            this.markers = List.of(markers);
        }
    }
}

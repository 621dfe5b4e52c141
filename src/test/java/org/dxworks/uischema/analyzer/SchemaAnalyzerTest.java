package org.dxworks.uischema.analyzer;

import org.dxworks.uischema.Platform;
import org.dxworks.uischema.UiSchemaConfig;
import org.dxworks.uischema.analyzer.extractor.DestructuringExtractor;
import org.dxworks.uischema.model.CanonicalType;
import org.dxworks.uischema.model.EventDefinition;
import org.dxworks.uischema.model.PropertyDefinition;
import org.dxworks.uischema.model.Schema;
import org.dxworks.uischema.model.SourceUnit;
import org.junit.jupiter.api.Test;
import org.treesitter.TSNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaAnalyzerTest {
    private static final String BUTTON = String.join("\n",
            "import React from 'react';",
            "interface Props { text: string; onClick?: () => void; }",
            "export function Button({ text, onClick }: Props) { return null; }");

    private final SchemaAnalyzer analyzer = new SchemaAnalyzer(UiSchemaConfig.defaults());

    @Test
    void interfaceAndDestructuringYieldPropsAndEvents() {
        Schema schema = analyzer.analyze(SourceUnit.ofSource("Button", BUTTON));

        assertEquals("Button", schema.getName());
        assertEquals(Platform.REACT, schema.getPlatform());
        assertEquals(List.of(new PropertyDefinition("text", CanonicalType.TEXT, true)), schema.getProps());
        assertEquals(List.of(new EventDefinition("onClick", List.of())), schema.getEvents());
        assertFalse(schema.isSupportsChildren());
        assertFalse(schema.isDegraded());
    }

    @Test
    void interfaceTypeWinsOverDestructuredDefault() {
        String source = String.join("\n",
                "interface BadgeProps { count: number; }",
                "export function Badge({ count = 0 }: BadgeProps) { return null; }");

        Schema schema = analyzer.analyze(SourceUnit.ofSource("Badge", source));

        assertEquals(List.of(new PropertyDefinition("count", CanonicalType.NUMBER, true)), schema.getProps());
    }

    @Test
    void destructuredDefaultsAreKept() {
        String source = "export function Chip({ label = 'new', size = 2, round = true, ratio = 1.5, icon = null }) { return null; }";

        Schema schema = analyzer.analyze(SourceUnit.ofSource("Chip", source));

        assertEquals(List.of(
                new PropertyDefinition("label", CanonicalType.TEXT, true, null, "new"),
                new PropertyDefinition("size", CanonicalType.TEXT, true, null, 2),
                new PropertyDefinition("round", CanonicalType.TEXT, true, null, true),
                new PropertyDefinition("ratio", CanonicalType.TEXT, true, null, 1.5),
                new PropertyDefinition("icon", CanonicalType.TEXT, true)), schema.getProps());
    }

    @Test
    void methodSignaturesBecomeEventsOrFunctionProps() {
        String source = String.join("\n",
                "interface ListProps {",
                "  onSelect(index: number, item: string): void;",
                "  renderItem(item: string): string;",
                "}");

        Schema schema = analyzer.analyze(SourceUnit.ofSource("List", source));

        assertEquals(List.of(new PropertyDefinition("renderItem", CanonicalType.FUNCTION, true)), schema.getProps());
        assertEquals(List.of(new EventDefinition("onSelect", List.of("index", "item"))), schema.getEvents());
    }

    @Test
    void nonObjectTypeAliasesAreIgnored() {
        String source = String.join("\n",
                "type Size = 'sm' | 'md' | 'lg';",
                "type Props = { size?: Size };");

        Schema schema = analyzer.analyze(SourceUnit.ofSource("Sized", source));

        assertEquals(List.of(new PropertyDefinition("size", CanonicalType.TEXT, false)), schema.getProps());
    }

    @Test
    void markupEventsAndChildren() throws IOException {
        Schema toggle = analyzeFixture("Toggle", "Toggle.jsx");
        assertTrue(toggle.isSupportsChildren());
        assertEquals(List.of("onClick", "onMouseEnter", "onChange"), eventNames(toggle));

        Schema avatar = analyzeFixture("Avatar", "Avatar.jsx");
        assertFalse(avatar.isSupportsChildren());
        assertEquals(List.of("onLoad"), eventNames(avatar));
        assertEquals(List.of(
                new PropertyDefinition("src", CanonicalType.TEXT, true),
                new PropertyDefinition("size", CanonicalType.TEXT, true, null, 48)), avatar.getProps());
    }

    @Test
    void typedSourceWithMarkupKeepsMarkupEventsAndChildren() {
        String source = "interface Props { text: string; onClick?: () => void } "
                + "export function Button({ text, onClick }: Props) { "
                + "return <button onClick={onClick} onMouseEnter={() => {}}><span>{text}</span></button>; }";

        Schema schema = analyzer.analyze(SourceUnit.ofSource("Button", source));

        assertFalse(schema.isDegraded());
        assertTrue(schema.isSupportsChildren());
        assertEquals(List.of("onClick", "onMouseEnter"), eventNames(schema));
        assertEquals(List.of(new PropertyDefinition("text", CanonicalType.TEXT, true)), schema.getProps());
    }

    @Test
    void callbackParametersAreNotProps() {
        String source = "export function List({ items }) { "
                + "return <ul>{items.map(({ id, label }) => <li key={id}>{label}</li>)}</ul>; }";

        Schema schema = analyzer.analyze(SourceUnit.ofSource("List", source));

        assertEquals(List.of(new PropertyDefinition("items", CanonicalType.TEXT, true)), schema.getProps());
    }

    @Test
    void wrappedArrowComponentsAreRead() {
        String source = String.join("\n",
                "import { memo, forwardRef } from 'react';",
                "export const Tag = memo(({ label }) => <span onClick={() => track(({ ignored }) => ignored)}>{label}</span>);",
                "export const Field = React.forwardRef(({ value = '' }, ref) => <input ref={ref} value={value} />);");

        Schema tag = analyzer.analyze(SourceUnit.ofSource("Tag", source));

        assertEquals(List.of(
                new PropertyDefinition("label", CanonicalType.TEXT, true),
                new PropertyDefinition("value", CanonicalType.TEXT, true, null, "")), tag.getProps());
    }

    @Test
    void vueTemplateEventsDropModifiers() {
        String source = String.join("\n",
                "<template>",
                "  <div class=\"search\">",
                "    <input v-on:input=\"update\" @keyup.enter=\"submit\" />",
                "    <!-- <button @dblclick=\"reset\">x</button> -->",
                "  </div>",
                "</template>",
                "<script>",
                "export default { props: ['query'] };",
                "</script>");

        Schema schema = analyzer.analyze(SourceUnit.ofSource("Search", source));

        assertEquals(Platform.VUE, schema.getPlatform());
        assertEquals(List.of("onInput", "onKeyup"), eventNames(schema));
        assertTrue(schema.isSupportsChildren());
    }

    @Test
    void svelteTemplateEventsDropModifiers() {
        String source = String.join("\n",
                "<script>",
                "  export let label;",
                "  $: upper = label.toUpperCase();",
                "</script>",
                "",
                "<a href=\"#\" on:click|preventDefault={go}></a>",
                "<img src=\"x.png\" on:load={loaded}>",
                "<style>button { color: red; }</style>");

        Schema schema = analyzer.analyze(SourceUnit.ofSource("Link", source));

        assertEquals(Platform.SVELTE, schema.getPlatform());
        assertEquals(List.of("onClick", "onLoad"), eventNames(schema));
        assertFalse(schema.isSupportsChildren());
    }

    @Test
    void eventShapedNamesNeverAppearAsProps() throws IOException {
        for (String fixture : List.of("Button.tsx", "ActionButton.tsx", "Card.ts", "Toggle.jsx", "Avatar.jsx", "Counter.vue")) {
            Schema schema = analyzeFixture(fixture, fixture);
            for (PropertyDefinition prop : schema.getProps()) {
                assertFalse(prop.getName().matches("^on[A-Z].*"), fixture + " exposes " + prop.getName());
            }
        }
    }

    @Test
    void platformIsDeterministic() {
        SourceUnit unit = SourceUnit.ofSource("Button", BUTTON);
        Platform first = analyzer.analyze(unit).getPlatform();
        for (int i = 0; i < 5; i++) {
            assertEquals(first, analyzer.analyze(unit).getPlatform());
        }
    }

    @Test
    void decoratedClassIsAngular() {
        String source = String.join("\n",
                "import { Component, Input } from '@angular/core';",
                "@Component({ selector: 'app-hello', template: '<p>{{ name }}</p>' })",
                "export class HelloComponent { @Input() name: string = ''; }");

        Schema schema = analyzer.analyze(SourceUnit.ofSource("Hello", source));

        assertEquals(Platform.ANGULAR, schema.getPlatform());
        assertFalse(schema.isDegraded());
    }

    @Test
    void sourceWithoutSignalsIsUniversal() {
        Schema schema = analyzer.analyze(SourceUnit.ofSource("Plain", "export const answer = 42;"));

        assertEquals(Platform.UNIVERSAL, schema.getPlatform());
        assertTrue(schema.getProps().isEmpty());
        assertFalse(schema.isDegraded());
    }

    @Test
    void malformedSourceYieldsFallback() {
        Schema schema = analyzer.analyze(SourceUnit.ofSource("Broken", "}}}} <<<< (((( :::: >>>>"));

        assertEquals(Schema.fallback("Broken"), schema);
    }

    @Test
    void missingInputYieldsFallback() {
        assertEquals(Schema.fallback(""), analyzer.analyze(null));
        assertEquals(Schema.fallback("Empty"), analyzer.analyze(SourceUnit.ofSource("Empty", "   ")));
    }

    @Test
    void sourceOverTheLineLimitYieldsFallback() {
        SchemaAnalyzer limited = new SchemaAnalyzer(UiSchemaConfig.with(2, false));

        Schema schema = limited.analyze(SourceUnit.ofSource("Button", BUTTON));

        assertTrue(schema.isDegraded());
    }

    @Test
    void sourceTextTakesPrecedenceOverRuntimeShape() {
        Map<String, Object> runtime = Map.of("selector", "app-button", "inputs", List.of("label"));

        Schema schema = analyzer.analyze(new SourceUnit("Button", BUTTON, runtime));

        assertEquals(Platform.REACT, schema.getPlatform());
        assertEquals("text", schema.getProps().get(0).getName());
    }

    @Test
    void runtimeShapeIsAnalyzedWhenThereIsNoSource() {
        Map<String, Object> runtime = Map.of(
                "selector", "app-button",
                "inputs", List.of("label"),
                "outputs", List.of("pressed"));

        Schema schema = analyzer.analyze(SourceUnit.ofRuntime("AppButton", runtime));

        assertEquals(Platform.ANGULAR, schema.getPlatform());
        assertEquals(List.of(new PropertyDefinition("label", CanonicalType.TEXT, false)), schema.getProps());
        assertEquals(List.of(new EventDefinition("onPressed", List.of())), schema.getEvents());
        assertEquals("Component AppButton analyzed from runtime shape", schema.getDescription());
    }

    @Test
    void failingExtractorDoesNotAbortTheWalk() {
        NodeExtractor failing = new NodeExtractor() {
            @Override
            public Set<String> nodeTypes() {
                return Set.of("interface_declaration");
            }

            @Override
            public void extract(TSNode node, WalkContext context) {
                throw new IllegalStateException("unsupported declaration");
            }
        };
        SchemaAnalyzer partial = new SchemaAnalyzer(new SourceParser(20000),
                new SyntaxWalker(List.of(failing, new DestructuringExtractor())));

        Schema schema = partial.analyze(SourceUnit.ofSource("Button", BUTTON));

        assertFalse(schema.isDegraded());
        assertEquals(List.of(new PropertyDefinition("text", CanonicalType.TEXT, true)), schema.getProps());
        assertEquals(List.of(new EventDefinition("onClick", List.of())), schema.getEvents());
    }

    @Test
    void parserCrashYieldsFallback() {
        SourceParser crashing = new SourceParser(20000) {
            @Override
            public ParsedSource parse(String componentName, String sourceText) {
                throw new IllegalStateException("native parser unavailable");
            }
        };
        SchemaAnalyzer broken = new SchemaAnalyzer(crashing, SyntaxWalker.withDefaultExtractors());

        Schema schema = broken.analyze(SourceUnit.ofSource("Button", BUTTON));

        assertEquals(Schema.fallback("Button"), schema);
    }

    @Test
    void concurrentCallsAgreeWithSequentialResult() throws Exception {
        String card = Files.readString(Paths.get("src/test/resources/samples/components/Card.ts"));
        Schema expected = analyzer.analyze(SourceUnit.ofSource("Card", card));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Schema>> futures = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                String source = i % 2 == 0 ? card : BUTTON;
                String name = i % 2 == 0 ? "Card" : "Button";
                futures.add(pool.submit(() -> analyzer.analyze(SourceUnit.ofSource(name, source))));
            }
            for (int i = 0; i < futures.size(); i++) {
                Schema schema = futures.get(i).get();
                assertNotNull(schema);
                if (i % 2 == 0) {
                    assertEquals(expected, schema);
                } else {
                    assertEquals("Button", schema.getName());
                    assertEquals(1, schema.getProps().size());
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private Schema analyzeFixture(String name, String file) throws IOException {
        String source = Files.readString(Paths.get("src/test/resources/samples/components", file));
        return analyzer.analyze(SourceUnit.ofSource(name, source));
    }

    private static List<String> eventNames(Schema schema) {
        List<String> names = new ArrayList<>();
        for (EventDefinition event : schema.getEvents()) {
            names.add(event.getName());
        }
        return names;
    }
}

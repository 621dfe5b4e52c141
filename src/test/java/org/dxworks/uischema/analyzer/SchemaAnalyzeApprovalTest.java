package org.dxworks.uischema.analyzer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.approvaltests.Approvals;
import org.dxworks.uischema.App;
import org.dxworks.uischema.ComponentFileKind;
import org.dxworks.uischema.UiSchemaConfig;
import org.dxworks.uischema.model.Schema;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

public class SchemaAnalyzeApprovalTest {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private static final SchemaAnalyzer ANALYZER = new SchemaAnalyzer(UiSchemaConfig.defaults());

    @Test
    void analyze_Button() throws Exception {
        verify(Paths.get("src/test/resources/samples/components/Button.tsx"));
    }

    @Test
    void analyze_ActionButton() throws Exception {
        verify(Paths.get("src/test/resources/samples/components/ActionButton.tsx"));
    }

    @Test
    void analyze_Card() throws Exception {
        verify(Paths.get("src/test/resources/samples/components/Card.ts"));
    }

    @Test
    void analyze_Toggle() throws Exception {
        verify(Paths.get("src/test/resources/samples/components/Toggle.jsx"));
    }

    @Test
    void analyze_CounterSingleFileComponent() throws Exception {
        verify(Paths.get("src/test/resources/samples/components/Counter.vue"));
    }

    @Test
    void analyze_RatingRuntimeDescriptor() throws Exception {
        verify(Paths.get("src/test/resources/samples/components/Rating.component.json"));
    }

    @Test
    void analyze_Broken() throws Exception {
        verify(Paths.get("src/test/resources/samples/components/Broken.ts"));
    }

    private static void verify(Path file) throws Exception {
        ComponentFileKind kind = ComponentFileKind.detect(file).orElseThrow();
        Schema schema = ANALYZER.analyze(App.readComponent(file, kind));
        Approvals.verify(MAPPER.writeValueAsString(schema));
    }
}

package org.dxworks.uischema.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.uischema.model.Schema;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * JSON wire form of schemas.
 */
public final class SchemaJson {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<List<Schema>> SCHEMA_LIST = new TypeReference<>() { };

    private SchemaJson() {
        // utility class
    }

    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not serialize schema", e);
        }
    }

    public static List<Schema> readAll(String json) {
        try {
            return MAPPER.readValue(json, SCHEMA_LIST);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not read schemas", e);
        }
    }
}

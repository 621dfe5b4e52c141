package org.dxworks.uischema.registry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.uischema.analyzer.SchemaAnalyzer;
import org.dxworks.uischema.model.Schema;
import org.dxworks.uischema.model.SourceUnit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemorySchemaRegistry implements SchemaRegistry {
    private static final Logger logger = LogManager.getLogger(InMemorySchemaRegistry.class);

    private final SchemaAnalyzer analyzer;
    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();

    public InMemorySchemaRegistry(SchemaAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Analysis runs outside the map's locks, so a slow component never blocks registrations that hash to the same
     * bin. Two racing registrations of the same unit may both analyze; the first stored schema is kept.
     */
    @Override
    public Schema register(SourceUnit unit) {
        String name = unit.getComponentName();
        Entry existing = entries.get(name);
        if (existing != null && existing.unit.equals(unit)) {
            return existing.schema;
        }

        Schema schema = analyzer.analyze(unit);
        if (schema.isDegraded()) {
            logger.warn("Component {} registered with a degraded schema", name);
        }
        Entry analyzed = new Entry(unit, schema);
        Entry stored = entries.compute(name, (key, current) ->
                current != null && current.unit.equals(unit) ? current : analyzed);
        return stored.schema;
    }

    @Override
    public Optional<Schema> find(String componentName) {
        Entry entry = entries.get(componentName);
        return entry == null ? Optional.empty() : Optional.of(entry.schema);
    }

    @Override
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(entries.keySet()));
    }

    @Override
    public boolean remove(String componentName) {
        return entries.remove(componentName) != null;
    }

    @Override
    public String exportJson() {
        List<Schema> schemas = new ArrayList<>();
        for (String name : names()) {
            find(name).ifPresent(schemas::add);
        }
        return SchemaJson.write(schemas);
    }

    private static final class Entry {
        private final SourceUnit unit;
        private final Schema schema;

        private Entry(SourceUnit unit, Schema schema) {
            this.unit = unit;
            this.schema = schema;
        }
    }
}

package org.dxworks.uischema.registry;

import org.dxworks.uischema.model.Schema;
import org.dxworks.uischema.model.SourceUnit;

import java.util.Optional;
import java.util.Set;

/**
 * Stores component schemas by component name. Registration never fails because of analysis problems; a
 * component that cannot be analyzed is stored with its fallback schema.
 */
public interface SchemaRegistry {

    Schema register(SourceUnit unit);

    Optional<Schema> find(String componentName);

    Set<String> names();

    boolean remove(String componentName);

    String exportJson();
}

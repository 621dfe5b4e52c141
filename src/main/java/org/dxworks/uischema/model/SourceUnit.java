package org.dxworks.uischema.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Input of one analysis call: a component name plus its source text and/or a runtime shape descriptor.
 */
public final class SourceUnit {
    private final String componentName;
    private final String sourceText;
    private final Map<String, Object> runtimeRef;

    public SourceUnit(String componentName, String sourceText, Map<String, Object> runtimeRef) {
        this.componentName = componentName == null ? "" : componentName;
        this.sourceText = sourceText;
        this.runtimeRef = runtimeRef == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(runtimeRef));
    }

    public static SourceUnit ofSource(String componentName, String sourceText) {
        return new SourceUnit(componentName, sourceText, null);
    }

    public static SourceUnit ofRuntime(String componentName, Map<String, Object> runtimeRef) {
        return new SourceUnit(componentName, null, runtimeRef);
    }

    public String getComponentName() {
        return componentName;
    }

    public String getSourceText() {
        return sourceText;
    }

    public Map<String, Object> getRuntimeRef() {
        return runtimeRef;
    }

    public boolean hasSourceText() {
        return sourceText != null && !sourceText.isBlank();
    }

    public boolean hasRuntimeRef() {
        return runtimeRef != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceUnit)) return false;
        SourceUnit that = (SourceUnit) o;
        return componentName.equals(that.componentName)
                && Objects.equals(sourceText, that.sourceText)
                && Objects.equals(runtimeRef, that.runtimeRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(componentName, sourceText, runtimeRef);
    }
}

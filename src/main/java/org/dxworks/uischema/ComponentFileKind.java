package org.dxworks.uischema;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public enum ComponentFileKind {
    RUNTIME_DESCRIPTOR("runtime-descriptor", ".component.json"),
    TYPESCRIPT("typescript", ".tsx", ".ts"),
    JAVASCRIPT("javascript", ".jsx", ".js", ".mjs"),
    VUE("vue", ".vue"),
    SVELTE("svelte", ".svelte");

    private final String name;
    private final String[] extensions;

    ComponentFileKind(String name, String... extensions) {
        this.name = name;
        this.extensions = extensions;
    }

    public String getName() {
        return name;
    }

    public static Optional<ComponentFileKind> detect(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".d.ts")) {
            return Optional.empty();
        }
        for (ComponentFileKind kind : values()) {
            for (String extension : kind.extensions) {
                if (fileName.endsWith(extension)) {
                    return Optional.of(kind);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Component name for a file: the file name without its extension ({@code Button.component.json -> Button}).
     */
    public String componentName(Path filePath) {
        String fileName = filePath.getFileName().toString();
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (lower.endsWith(extension)) {
                return fileName.substring(0, fileName.length() - extension.length());
            }
        }
        return fileName;
    }
}

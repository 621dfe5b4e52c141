package org.dxworks.uischema;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class UiSchemaConfig {
    private static final Logger logger = LogManager.getLogger(UiSchemaConfig.class);

    private static final int DEFAULT_MAX_SOURCE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "uischema-config.yml";
    private static final boolean DEFAULT_PARALLEL = true;

    private final int maxSourceLines;
    private final boolean parallel;

    private UiSchemaConfig(int maxSourceLines, boolean parallel) {
        this.maxSourceLines = maxSourceLines;
        this.parallel = parallel;
    }

    public int getMaxSourceLines() {
        return maxSourceLines;
    }

    public boolean isParallel() {
        return parallel;
    }

    public static UiSchemaConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static UiSchemaConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                Integer maxSourceLines = yamlConfig.maxSourceLines;
                Boolean parallel = yamlConfig.parallel;

                int effectiveMaxSourceLines = (maxSourceLines != null && maxSourceLines > 0)
                        ? maxSourceLines
                        : DEFAULT_MAX_SOURCE_LINES;
                boolean effectiveParallel = parallel != null ? parallel : DEFAULT_PARALLEL;

                return new UiSchemaConfig(effectiveMaxSourceLines, effectiveParallel);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static UiSchemaConfig defaults() {
        return new UiSchemaConfig(DEFAULT_MAX_SOURCE_LINES, DEFAULT_PARALLEL);
    }

    public static UiSchemaConfig with(int maxSourceLines, boolean parallel) {
        int effectiveMaxSourceLines = maxSourceLines > 0 ? maxSourceLines : DEFAULT_MAX_SOURCE_LINES;
        return new UiSchemaConfig(effectiveMaxSourceLines, parallel);
    }

    private static class YamlConfig {
        public Integer maxSourceLines;
        public Boolean parallel;
    }
}

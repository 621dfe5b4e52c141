package org.dxworks.uischema;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.uischema.analyzer.SchemaAnalyzer;
import org.dxworks.uischema.model.Schema;
import org.dxworks.uischema.model.SourceUnit;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> RUNTIME_SHAPE = new TypeReference<>() { };

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar uischema.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to a component source directory or file");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.err.println("Supported inputs: .ts, .tsx, .js, .jsx, .vue, .svelte, .component.json");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        UiSchemaConfig config = UiSchemaConfig.load();
        SchemaAnalyzer analyzer = new SchemaAnalyzer(config);

        System.out.println("Starting component schema extraction...");
        System.out.println("Input: " + input.toAbsolutePath());

        List<Path> files = collectComponentFiles(input, config.getMaxSourceLines());
        System.out.println("Found " + files.size() + " component files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger degradedCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writeLine(writer, runInfo);

            Stream<Path> stream = config.isParallel() ? files.parallelStream() : files.stream();
            stream.forEach(file -> {
                Optional<ComponentFileKind> kindOpt = ComponentFileKind.detect(file);
                if (kindOpt.isEmpty()) {
                    return;
                }

                ComponentFileKind kind = kindOpt.get();
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Analyzing "
                            + kind.getName() + ": " + file.getFileName());
                }

                try {
                    Schema schema = analyzer.analyze(readComponent(file, kind));
                    Map<String, Object> line = new LinkedHashMap<>();
                    line.put("kind", "schema");
                    line.put("file", file.toString());
                    line.put("schema", schema);
                    writeLine(writer, line);

                    successCount.incrementAndGet();
                    if (schema.isDegraded()) {
                        degradedCount.incrementAndGet();
                    }
                } catch (IOException e) {
                    Map<String, Object> error = new LinkedHashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("error", e.getMessage());
                    try {
                        writeLine(writer, error);
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error reading " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("components_analyzed", successCount.get());
            doneInfo.put("components_degraded", degradedCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writeLine(writer, doneInfo);
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Extraction complete!");
        System.out.println("Components analyzed: " + successCount.get());
        if (degradedCount.get() > 0) {
            System.out.println("Degraded (fallback) schemas: " + degradedCount.get());
        }
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static List<Path> collectComponentFiles(Path input, int maxSourceLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> !isInNodeModules(p))
                      .filter(p -> ComponentFileKind.detect(p).isPresent())
                      .filter(p -> withinMaxLines(p, maxSourceLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)
                && ComponentFileKind.detect(input).isPresent()
                && withinMaxLines(input, maxSourceLines)) {
            files.add(input);
        }

        return files;
    }

    public static SourceUnit readComponent(Path file, ComponentFileKind kind) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        String componentName = kind.componentName(file);
        if (kind == ComponentFileKind.RUNTIME_DESCRIPTOR) {
            return SourceUnit.ofRuntime(componentName, MAPPER.readValue(content, RUNTIME_SHAPE));
        }
        return SourceUnit.ofSource(componentName, content);
    }

    private static boolean isInNodeModules(Path path) {
        for (Path part : path) {
            if ("node_modules".equals(part.toString())) return true;
        }
        return false;
    }

    private static boolean withinMaxLines(Path path, int maxSourceLines) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxSourceLines + 1L).count();
            return count <= maxSourceLines;
        } catch (IOException | UncheckedIOException e) {
            return true;
        }
    }

    private static void writeLine(BufferedWriter writer, Object value) throws IOException {
        String json = MAPPER.writeValueAsString(value);
        synchronized (writer) {
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }
}

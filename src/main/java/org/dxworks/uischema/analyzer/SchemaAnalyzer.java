package org.dxworks.uischema.analyzer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.uischema.Platform;
import org.dxworks.uischema.PlatformDetector;
import org.dxworks.uischema.UiSchemaConfig;
import org.dxworks.uischema.model.EventDefinition;
import org.dxworks.uischema.model.PropertyDefinition;
import org.dxworks.uischema.model.Schema;
import org.dxworks.uischema.model.SourceUnit;

import java.util.List;

/**
 * Entry point of schema extraction: detect platform, parse, walk, deduplicate, assemble.
 * <p>
 * {@link #analyze(SourceUnit)} is total. Any failure escaping a stage is logged and turned into
 * {@link Schema#fallback(String)}. The analyzer keeps no per-call state, so one instance can serve concurrent
 * callers without locking.
 */
public class SchemaAnalyzer {
    private static final Logger logger = LogManager.getLogger(SchemaAnalyzer.class);

    private final SourceParser parser;
    private final SyntaxWalker walker;

    public SchemaAnalyzer() {
        this(UiSchemaConfig.load());
    }

    public SchemaAnalyzer(UiSchemaConfig config) {
        this(new SourceParser(config.getMaxSourceLines()), SyntaxWalker.withDefaultExtractors());
    }

    public SchemaAnalyzer(SourceParser parser, SyntaxWalker walker) {
        this.parser = parser;
        this.walker = walker;
    }

    public Schema analyze(SourceUnit input) {
        String name = input == null ? "" : input.getComponentName();
        AnalysisStage stage = AnalysisStage.ACCEPT_INPUT;
        try {
            if (input == null) {
                throw new SchemaAnalysisException(stage, "No input");
            }
            if (input.hasSourceText()) {
                stage = AnalysisStage.DETECT_PLATFORM;
                Platform platform = PlatformDetector.detect(input.getSourceText());

                stage = AnalysisStage.PARSE;
                ParsedSource parsed = parser.parse(name, input.getSourceText());

                stage = AnalysisStage.WALK_SYNTAX;
                WalkContext context = new WalkContext(name, parsed);
                walker.walk(parsed, context);
                TemplateMarkupScanner.scan(parsed.getTemplateMarkup(), context);

                stage = AnalysisStage.DEDUPLICATE;
                List<PropertyDefinition> props = CandidateMerger.mergeProperties(context.getProperties());
                List<EventDefinition> events = CandidateMerger.mergeEvents(context.getEvents());

                stage = AnalysisStage.ASSEMBLE;
                return new Schema(name, platform, props, events, context.hasMarkupWithChildren(),
                        "Component " + name + " analyzed from " + parsed.getDialect().getName() + " source", false);
            }
            if (input.hasRuntimeRef()) {
                stage = AnalysisStage.DETECT_PLATFORM;
                Platform platform = PlatformDetector.detect(input.getRuntimeRef());

                stage = AnalysisStage.READ_RUNTIME_SHAPE;
                CandidateCollector collector = new CandidateCollector();
                RuntimeShapeReader.read(platform, input.getRuntimeRef(), collector);

                stage = AnalysisStage.DEDUPLICATE;
                List<PropertyDefinition> props = CandidateMerger.mergeProperties(collector.getProperties());
                List<EventDefinition> events = CandidateMerger.mergeEvents(collector.getEvents());

                stage = AnalysisStage.ASSEMBLE;
                return new Schema(name, platform, props, events, false,
                        "Component " + name + " analyzed from runtime shape", false);
            }
            throw new ParseFailureException("Nothing to analyze for component " + name);
        } catch (SchemaAnalysisException e) {
            logger.warn("Component {}: analysis failed at stage {}, using fallback schema: {}",
                    name, e.getStage(), e.getMessage(), e);
            return Schema.fallback(name);
        } catch (RuntimeException | LinkageError e) {
            logger.warn("Component {}: analysis failed at stage {}, using fallback schema: {}",
                    name, stage, e.toString(), e);
            return Schema.fallback(name);
        }
    }
}

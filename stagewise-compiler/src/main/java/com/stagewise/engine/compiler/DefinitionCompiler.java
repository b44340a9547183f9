package com.stagewise.engine.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.stagewise.engine.api.exceptions.DefinitionException;
import com.stagewise.engine.api.model.definition.ExperimentDefinition;
import com.stagewise.engine.api.model.definition.NodeDefinition;
import com.stagewise.engine.compiler.expression.ExpressionParser;
import com.stagewise.engine.compiler.model.ExperimentModel;
import com.stagewise.engine.compiler.model.ExperimentNode;
import com.stagewise.engine.compiler.model.NodeLevel;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Loads, validates and compiles experiment definitions into an
 * {@link ExperimentModel}.
 *
 * <p>Compilation parses every visibility rule once into an expression tree and
 * builds the dependency graph. A definition with any validation error is
 * rejected as a whole with a {@link DefinitionException} listing all errors,
 * so problems surface at authoring time and never during navigation.
 */
public class DefinitionCompiler {

    private static final Logger logger = Logger.getLogger(DefinitionCompiler.class.getName());

    private final ObjectMapper jsonMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final ExpressionParser parser = new ExpressionParser();
    private final DefinitionValidator validator = new DefinitionValidator(parser);
    private final Tracer tracer;

    public DefinitionCompiler() {
        this(OpenTelemetry.noop().getTracer("stagewise-compiler"));
    }

    public DefinitionCompiler(Tracer tracer) {
        this.tracer = tracer;
    }

    /**
     * Compiles a JSON ({@code .json}) or YAML ({@code .yaml}/{@code .yml}) file.
     */
    public ExperimentModel compile(Path definitionPath) {
        String fileName = definitionPath.getFileName().toString().toLowerCase(Locale.ROOT);
        boolean yaml = fileName.endsWith(".yaml") || fileName.endsWith(".yml");
        try {
            String content = Files.readString(definitionPath);
            return compile(read(content, yaml ? yamlMapper : jsonMapper));
        } catch (IOException e) {
            throw new DefinitionException("Cannot read definition " + definitionPath + ": " + e.getMessage(), e);
        }
    }

    public ExperimentModel compileJson(String json) {
        return compile(read(json, jsonMapper));
    }

    public ExperimentModel compileYaml(String yaml) {
        return compile(read(yaml, yamlMapper));
    }

    /**
     * Validates and compiles an already-parsed definition.
     *
     * @throws DefinitionException if validation reports any error
     */
    public ExperimentModel compile(ExperimentDefinition definition) {
        Span span = tracer.spanBuilder("compile-definition").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();

            List<String> errors = validator.validate(definition);
            if (!errors.isEmpty()) {
                span.setAttribute("validationErrorCount", errors.size());
                throw new DefinitionException(errors);
            }

            int[] order = {0};
            ExperimentNode.Builder root = ExperimentNode.builder(definition.meta().id(), NodeLevel.EXPERIMENT)
                    .label(definition.meta().name())
                    .definitionOrder(order[0]++)
                    .rules(definition.rules());
            for (NodeDefinition phase : definition.phases()) {
                root.child(buildNode(phase, NodeLevel.PHASE, definition.meta().id(), order));
            }

            ExperimentModel model = new ExperimentModel(definition.meta().id(),
                    definition.meta().version(), definition.meta().name(), root.build());

            long elapsed = System.nanoTime() - startTime;
            span.setAttribute("experimentId", model.experimentId());
            span.setAttribute("nodeCount", model.nodes().size());
            span.setAttribute("unitCount", model.leaves().size());
            span.setAttribute("dependencyEdgeCount", model.dependencyGraph().edgeCount());
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(elapsed));
            logger.info(String.format("Compiled experiment %s v%d: %d nodes, %d units, %d dependency edges in %d ms",
                    model.experimentId(), model.version(), model.nodes().size(), model.leaves().size(),
                    model.dependencyGraph().edgeCount(), TimeUnit.NANOSECONDS.toMillis(elapsed)));
            return model;
        } catch (DefinitionException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Returns every validation error of the definition; empty when valid.
     */
    public List<String> validate(ExperimentDefinition definition) {
        return validator.validate(definition);
    }

    private ExperimentNode buildNode(NodeDefinition def, NodeLevel level, String parentId, int[] order) {
        ExperimentNode.Builder builder = ExperimentNode.builder(def.id(), level)
                .label(def.label())
                .type(def.type())
                .parentId(parentId)
                .definitionOrder(order[0]++)
                .rules(def.rules())
                .visibility(def.rules().visibility() == null ? null : parser.parse(def.rules().visibility()))
                .pickAssigns(def.pickAssigns())
                .allowJumpToCompleted(def.allowJumpToCompleted())
                .reference(def.reference())
                .editableAfterSubmit(def.editableAfterSubmit())
                .invalidatesDependents(def.invalidatesDependents())
                .fields(def.fields());
        for (NodeDefinition child : childrenAt(def, level)) {
            builder.child(buildNode(child, level.childLevel(), def.id(), order));
        }
        return builder.build();
    }

    /**
     * The child list a node at {@code level} is read from.
     */
    static List<NodeDefinition> childrenAt(NodeDefinition def, NodeLevel level) {
        return switch (level) {
            case PHASE -> def.stages();
            case STAGE -> def.blocks();
            case BLOCK -> def.tasks();
            case EXPERIMENT, TASK -> List.of();
        };
    }

    private static ExperimentDefinition read(String content, ObjectMapper mapper) {
        try {
            return mapper.readValue(content, ExperimentDefinition.class);
        } catch (JsonProcessingException e) {
            throw new DefinitionException("Malformed definition: " + e.getOriginalMessage(), e);
        }
    }
}

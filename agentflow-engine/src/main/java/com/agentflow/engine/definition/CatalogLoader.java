package com.agentflow.engine.definition;

import com.agentflow.core.exception.WorkflowValidationException;
import com.agentflow.core.model.EventKind;
import com.agentflow.core.model.FieldSpec;
import com.agentflow.core.model.LoopCondition;
import com.agentflow.core.model.PhaseDefinition;
import com.agentflow.core.model.TriggerMode;
import com.agentflow.core.model.TriggerPredicate;
import com.agentflow.core.model.WorkerDescriptor;
import com.agentflow.core.model.WorkflowDefinition;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads worker and workflow catalogs written in YAML.
 *
 * <pre>
 * workers:
 *   - id: code-reviewer
 *     capabilities: [code-review]
 *     triggers:
 *       - event: FILE_CHANGED
 *         field: path
 *         pattern: "\\.java$"
 *     outputs: [reviewFindings]
 * workflows:
 *   - name: quality-sprint
 *     phases:
 *       - id: review
 *         workers: [code-reviewer, "capability:security-review"]
 *         parallel: true
 *         loopUntil: "diagnostics.criticalCount == 0"
 *         maxIterations: 3
 * </pre>
 *
 * Unknown keys are rejected so that typos do not silently change a workflow.
 */
public class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    private final ObjectMapper yamlMapper;

    public CatalogLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
            .registerModule(new JavaTimeModule())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Parse one catalog document.
     *
     * @param input  YAML content; not closed by this method
     * @param source Name of the document, used in messages
     * @throws WorkflowValidationException if the document is malformed
     */
    public WorkflowCatalog load(InputStream input, String source) {
        CatalogDocument document;
        try {
            JsonNode tree = yamlMapper.readTree(input);
            if (tree == null || tree.isMissingNode() || tree.isNull()) {
                log.warn("Catalog {} is empty", source);
                return new WorkflowCatalog(source, List.of(), List.of());
            }
            document = yamlMapper.treeToValue(tree, CatalogDocument.class);
        } catch (IOException e) {
            throw new WorkflowValidationException("catalog",
                "cannot parse " + source + ": " + e.getMessage());
        }

        List<WorkerDescriptor> workers = toDescriptors(document.workers(), source);
        List<WorkflowDefinition> workflows = toDefinitions(document.workflows(), source);
        log.info("Loaded catalog {}: {} workers, {} workflows", source, workers.size(), workflows.size());
        return new WorkflowCatalog(source, workers, workflows);
    }

    // ========== Conversion ==========

    List<WorkerDescriptor> toDescriptors(List<WorkerEntry> entries, String source) {
        if (entries == null) {
            return List.of();
        }
        List<WorkerDescriptor> descriptors = new ArrayList<>();
        for (WorkerEntry entry : entries) {
            if (entry.id() == null || entry.id().isBlank()) {
                throw new WorkflowValidationException("workers", "entry without id in " + source);
            }
            WorkerDescriptor.Builder builder = WorkerDescriptor.builder()
                .id(entry.id())
                .description(entry.description())
                .critical(entry.critical() == null || entry.critical());
            if (entry.capabilities() != null) {
                builder.capabilities(entry.capabilities().toArray(String[]::new));
            }
            if (entry.triggers() != null) {
                for (TriggerEntry trigger : entry.triggers()) {
                    builder.trigger(toPredicate(entry.id(), trigger));
                }
            }
            if (entry.inputs() != null) {
                for (InputEntry input : entry.inputs()) {
                    builder.input(new FieldSpec(input.name(),
                        input.required() != null && input.required(), input.defaultValue()));
                }
            }
            if (entry.outputs() != null) {
                builder.outputs(entry.outputs());
            }
            if (entry.timeout() != null) {
                builder.timeout(entry.timeout());
            }
            if (entry.endpoint() != null) {
                builder.endpoint(URI.create(entry.endpoint()));
            }
            descriptors.add(builder.build());
        }
        return descriptors;
    }

    List<WorkflowDefinition> toDefinitions(List<WorkflowEntry> entries, String source) {
        if (entries == null) {
            return List.of();
        }
        List<WorkflowDefinition> definitions = new ArrayList<>();
        for (WorkflowEntry entry : entries) {
            WorkflowDefinition.Builder builder = WorkflowDefinition.builder()
                .name(entry.name())
                .description(entry.description())
                .labels(entry.labels() != null ? entry.labels() : Map.of());
            if (entry.phases() == null || entry.phases().isEmpty()) {
                throw new WorkflowValidationException("phases",
                    "workflow " + entry.name() + " in " + source + " has no phases");
            }
            for (PhaseEntry phase : entry.phases()) {
                builder.phase(toPhase(phase));
            }
            definitions.add(builder.build());
        }
        return definitions;
    }

    private PhaseDefinition toPhase(PhaseEntry entry) {
        PhaseDefinition.Builder builder = PhaseDefinition.builder(entry.id())
            .description(entry.description())
            .parallel(entry.parallel() != null && entry.parallel());
        if (entry.workers() != null) {
            builder.workers(entry.workers());
        }
        if (entry.loopUntil() != null) {
            if (entry.maxIterations() == null) {
                throw new WorkflowValidationException("maxIterations",
                    "phase " + entry.id() + " sets loopUntil without an iteration bound");
            }
            builder.loopUntil(LoopCondition.parse(entry.loopUntil()), entry.maxIterations());
        } else if (entry.maxIterations() != null) {
            builder.maxIterations(entry.maxIterations());
        }
        if (entry.dependsOn() != null) {
            builder.dependsOn(entry.dependsOn());
        }
        return builder.build();
    }

    private TriggerPredicate toPredicate(String workerId, TriggerEntry entry) {
        if (entry.event() == null || entry.pattern() == null) {
            throw new WorkflowValidationException("triggers",
                "worker " + workerId + " has a trigger without event or pattern");
        }
        EventKind kind;
        try {
            kind = EventKind.valueOf(entry.event().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new WorkflowValidationException("triggers",
                "worker " + workerId + " has unknown event kind: " + entry.event());
        }
        TriggerMode mode = entry.mode() != null
            ? TriggerMode.valueOf(entry.mode().trim().toUpperCase(Locale.ROOT))
            : TriggerMode.AUTOMATIC;
        try {
            return new TriggerPredicate(kind, entry.field(), Pattern.compile(entry.pattern()), mode);
        } catch (PatternSyntaxException e) {
            throw new WorkflowValidationException("triggers",
                "worker " + workerId + " has an invalid pattern: " + e.getDescription());
        }
    }

    // ========== Document Shape ==========

    record CatalogDocument(
        List<WorkerEntry> workers,
        List<WorkflowEntry> workflows
    ) {}

    record WorkerEntry(
        String id,
        String description,
        List<String> capabilities,
        List<TriggerEntry> triggers,
        List<InputEntry> inputs,
        List<String> outputs,
        Boolean critical,
        Duration timeout,
        String endpoint
    ) {}

    record TriggerEntry(
        String event,
        String field,
        String pattern,
        String mode
    ) {}

    record InputEntry(
        String name,
        Boolean required,
        @JsonProperty("default") JsonNode defaultValue
    ) {}

    record WorkflowEntry(
        String name,
        String description,
        Map<String, String> labels,
        List<PhaseEntry> phases
    ) {}

    record PhaseEntry(
        String id,
        String description,
        List<String> workers,
        Boolean parallel,
        String loopUntil,
        Integer maxIterations,
        List<String> dependsOn
    ) {}
}

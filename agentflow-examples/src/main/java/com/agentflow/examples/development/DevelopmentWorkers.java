package com.agentflow.examples.development;

import com.agentflow.core.model.Diagnostics;
import com.agentflow.core.model.EventKind;
import com.agentflow.core.model.FieldSpec;
import com.agentflow.core.model.Severity;
import com.agentflow.core.model.TriggerPredicate;
import com.agentflow.core.model.WorkerDescriptor;
import com.agentflow.core.repository.WorkerRegistry;
import com.agentflow.worker.Worker;
import com.agentflow.worker.WorkerContext;
import com.agentflow.worker.WorkerException;
import com.agentflow.worker.WorkerResult;
import com.agentflow.worker.invoker.LocalWorkerInvoker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in development workers.
 *
 * These workers demonstrate:
 * - Context passing (the API designer's spec feeds both implementers)
 * - Validation loops (the reviewer re-counts open smells after each refactoring pass)
 * - Trigger predicates on file changes, observed errors and completed workers
 * - Controlled failures through WorkerException
 *
 * Every worker is deterministic: findings are derived from the invocation argument
 * and the declared inputs only.
 */
public final class DevelopmentWorkers {

    private static final Logger log = LoggerFactory.getLogger(DevelopmentWorkers.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    // Worker IDs
    public static final String CODE_REVIEWER = "code-reviewer";
    public static final String SECURITY_AUDITOR = "security-auditor";
    public static final String PERFORMANCE_ANALYZER = "performance-analyzer";
    public static final String REFACTORING_EXPERT = "refactoring-expert";
    public static final String DEBUGGER = "debugger";
    public static final String TEST_GENERATOR = "test-generator";
    public static final String DOCUMENTATION_WRITER = "documentation-writer";
    public static final String API_DESIGNER = "api-designer";
    public static final String BACKEND_IMPLEMENTER = "backend-implementer";
    public static final String FRONTEND_IMPLEMENTER = "frontend-implementer";
    public static final String VISUAL_DESIGN_EXTRACTOR = "visual-design-extractor";

    // Context fields
    public static final String FIELD_REVIEW_FINDINGS = "reviewFindings";
    public static final String FIELD_FIXES_APPLIED = "fixesApplied";
    public static final String FIELD_REFACTORING_PLAN = "refactoringPlan";
    public static final String FIELD_SECURITY_REPORT = "securityReport";
    public static final String FIELD_PERFORMANCE_REPORT = "performanceReport";
    public static final String FIELD_ROOT_CAUSE = "rootCause";
    public static final String FIELD_API_SPEC = "apiSpec";
    public static final String FIELD_DESIGN_TOKENS = "designTokens";
    public static final String FIELD_BACKEND_MODULES = "backendModules";
    public static final String FIELD_FRONTEND_COMPONENTS = "frontendComponents";
    public static final String FIELD_TEST_SUITE = "testSuite";
    public static final String FIELD_DOCUMENTATION = "documentation";

    // Custom diagnostics counters
    public static final String COUNT_TESTS_GENERATED = "testsGenerated";

    // Keywords the reviewer reports as critical smells, fixed one per refactoring pass in this order
    static final List<String> CODE_SMELLS = List.of("legacy", "todo", "hack", "unsafe", "duplicate", "deprecated");

    private DevelopmentWorkers() {
    }

    // ========== Catalog ==========

    /**
     * Descriptors of all development workers, in registration order.
     */
    public static List<WorkerDescriptor> descriptors() {
        FieldSpec fixesApplied = FieldSpec.withDefault(FIELD_FIXES_APPLIED, IntNode.valueOf(0));
        List<WorkerDescriptor> descriptors = new ArrayList<>();

        descriptors.add(WorkerDescriptor.builder()
            .id(CODE_REVIEWER)
            .description("Reviews code for smells that block a release")
            .capabilities("code-review", "quality-review")
            .trigger(TriggerPredicate.on(EventKind.FILE_CHANGED, "path", "\\.(java|kt|ts|tsx|js|py|go)$"))
            .trigger(TriggerPredicate.on(EventKind.WORKER_COMPLETED, "workerId", "-implementer$")
                .requiringConfirmation())
            .input(fixesApplied)
            .outputs(FIELD_REVIEW_FINDINGS)
            .build());

        descriptors.add(WorkerDescriptor.builder()
            .id(SECURITY_AUDITOR)
            .description("Audits injection, secret handling and authentication flows")
            .capabilities("security-review", "security-audit")
            .trigger(TriggerPredicate.on(EventKind.FILE_CHANGED, "path", "(?i)(auth|security|crypto|login)"))
            .outputs(FIELD_SECURITY_REPORT)
            .build());

        descriptors.add(WorkerDescriptor.builder()
            .id(PERFORMANCE_ANALYZER)
            .description("Looks for hot paths, query patterns and caching gaps")
            .capabilities("performance-analysis")
            .trigger(TriggerPredicate.on(EventKind.ERROR_OBSERVED, "message", "(?i)(timeout|slow|latency)")
                .requiringConfirmation())
            .outputs(FIELD_PERFORMANCE_REPORT)
            .advisory()
            .build());

        descriptors.add(WorkerDescriptor.builder()
            .id(REFACTORING_EXPERT)
            .description("Applies one fix per pass for the open review finding or defect")
            .capabilities("refactoring", "quality-fix")
            .input(FieldSpec.optional(FIELD_REVIEW_FINDINGS))
            .input(FieldSpec.optional(FIELD_ROOT_CAUSE))
            .input(fixesApplied)
            .outputs(FIELD_FIXES_APPLIED, FIELD_REFACTORING_PLAN)
            .build());

        descriptors.add(WorkerDescriptor.builder()
            .id(DEBUGGER)
            .description("Reproduces a reported failure and verifies fixes")
            .capabilities("debugging", "root-cause-analysis")
            .trigger(TriggerPredicate.on(EventKind.ERROR_OBSERVED, "message", "(?i)(exception|error|panic|stack ?trace)"))
            .input(fixesApplied)
            .outputs(FIELD_ROOT_CAUSE)
            .build());

        descriptors.add(WorkerDescriptor.builder()
            .id(TEST_GENERATOR)
            .description("Generates contract, regression and smoke tests")
            .capabilities("test-generation", "quality-tests")
            .trigger(TriggerPredicate.on(EventKind.WORKER_COMPLETED, "workerId", "^(backend|frontend)-implementer$"))
            .input(FieldSpec.optional(FIELD_API_SPEC))
            .input(FieldSpec.optional(FIELD_ROOT_CAUSE))
            .input(FieldSpec.optional(FIELD_FRONTEND_COMPONENTS))
            .outputs(FIELD_TEST_SUITE)
            .build());

        descriptors.add(WorkerDescriptor.builder()
            .id(DOCUMENTATION_WRITER)
            .description("Writes reference documentation from what the run produced")
            .capabilities("documentation")
            .trigger(TriggerPredicate.on(EventKind.FILE_CHANGED, "path", "\\.(md|adoc)$"))
            .input(FieldSpec.optional(FIELD_API_SPEC))
            .input(FieldSpec.optional(FIELD_TEST_SUITE))
            .input(FieldSpec.optional(FIELD_REVIEW_FINDINGS))
            .input(FieldSpec.optional(FIELD_SECURITY_REPORT))
            .outputs(FIELD_DOCUMENTATION)
            .advisory()
            .build());

        descriptors.add(WorkerDescriptor.builder()
            .id(API_DESIGNER)
            .description("Designs REST resources and endpoints")
            .capabilities("api-design")
            .outputs(FIELD_API_SPEC)
            .build());

        descriptors.add(WorkerDescriptor.builder()
            .id(BACKEND_IMPLEMENTER)
            .description("Implements controllers, services and repositories for the API")
            .capabilities("implementation", "backend-implementation")
            .input(FieldSpec.required(FIELD_API_SPEC))
            .outputs(FIELD_BACKEND_MODULES)
            .build());

        descriptors.add(WorkerDescriptor.builder()
            .id(FRONTEND_IMPLEMENTER)
            .description("Implements list and form components for the API")
            .capabilities("implementation", "frontend-implementation")
            .input(FieldSpec.required(FIELD_API_SPEC))
            .input(FieldSpec.withDefault(FIELD_DESIGN_TOKENS, mapper.createObjectNode()))
            .outputs(FIELD_FRONTEND_COMPONENTS)
            .build());

        descriptors.add(WorkerDescriptor.builder()
            .id(VISUAL_DESIGN_EXTRACTOR)
            .description("Extracts colors, typography and spacing from design assets")
            .capabilities("visual-design", "design-extraction")
            .trigger(TriggerPredicate.on(EventKind.FILE_CHANGED, "path", "(?i)\\.(png|jpe?g|svg|fig)$")
                .requiringConfirmation())
            .outputs(FIELD_DESIGN_TOKENS)
            .build());

        return descriptors;
    }

    /**
     * Implementations keyed by worker id.
     */
    public static Map<String, Worker> implementations() {
        Map<String, Worker> workers = new LinkedHashMap<>();
        workers.put(CODE_REVIEWER, DevelopmentWorkers::reviewCode);
        workers.put(SECURITY_AUDITOR, DevelopmentWorkers::auditSecurity);
        workers.put(PERFORMANCE_ANALYZER, DevelopmentWorkers::analyzePerformance);
        workers.put(REFACTORING_EXPERT, DevelopmentWorkers::refactor);
        workers.put(DEBUGGER, DevelopmentWorkers::debug);
        workers.put(TEST_GENERATOR, DevelopmentWorkers::generateTests);
        workers.put(DOCUMENTATION_WRITER, DevelopmentWorkers::writeDocumentation);
        workers.put(API_DESIGNER, DevelopmentWorkers::designApi);
        workers.put(BACKEND_IMPLEMENTER, DevelopmentWorkers::implementBackend);
        workers.put(FRONTEND_IMPLEMENTER, DevelopmentWorkers::implementFrontend);
        workers.put(VISUAL_DESIGN_EXTRACTOR, DevelopmentWorkers::extractVisualDesign);
        return workers;
    }

    /**
     * Register every descriptor (replacing same-id entries) and bind its implementation.
     */
    public static void register(WorkerRegistry registry, LocalWorkerInvoker invoker) {
        for (WorkerDescriptor descriptor : descriptors()) {
            registry.register(descriptor, true);
        }
        implementations().forEach(invoker::bind);
        log.info("Registered {} development workers", implementations().size());
    }

    // ========== Review & Fix ==========

    /**
     * Code Reviewer.
     *
     * Reports each mentioned smell as a critical finding, minus the ones already fixed.
     * Asks for follow-up while findings remain open.
     */
    static WorkerResult reviewCode(WorkerContext context) {
        DevelopmentTarget target = DevelopmentTarget.of(context.getArgument());
        int fixes = context.getInput(FIELD_FIXES_APPLIED).map(JsonNode::asInt).orElse(0);

        List<String> smells = target.mentioned(CODE_SMELLS);
        List<String> open = smells.subList(Math.min(fixes, smells.size()), smells.size());

        ArrayNode findings = mapper.createArrayNode();
        Diagnostics.Builder diagnostics = Diagnostics.builder();
        for (String smell : open) {
            findings.addObject()
                .put("code", "CODE_SMELL")
                .put("keyword", smell)
                .put("severity", Severity.CRITICAL.name());
            diagnostics.entry(Severity.CRITICAL, "CODE_SMELL", smell + " code in " + target.describe());
        }

        log.info("Review of '{}' (pass {}): {} open findings", target.describe(), context.getIteration(), open.size());
        WorkerResult.Builder result = open.isEmpty() ? WorkerResult.success() : WorkerResult.needsFollowUp();
        return result
            .field(FIELD_REVIEW_FINDINGS, findings)
            .diagnostics(diagnostics.build())
            .build();
    }

    /**
     * Refactoring Expert.
     *
     * Fixes one open item per pass. Open items are the latest review findings or,
     * without findings, the open defects of the latest root-cause analysis.
     */
    static WorkerResult refactor(WorkerContext context) {
        int previous = context.getInput(FIELD_FIXES_APPLIED).map(JsonNode::asInt).orElse(0);
        JsonNode findings = context.getInput(FIELD_REVIEW_FINDINGS).orElse(mapper.createArrayNode());
        JsonNode rootCause = context.getInput(FIELD_ROOT_CAUSE).orElse(null);

        ArrayNode plan = mapper.createArrayNode();
        int open = findings.size();
        if (open > 0) {
            plan.add("Remove " + findings.get(0).path("keyword").asText() + " code");
        } else if (rootCause != null && !rootCause.path("resolved").asBoolean(true)) {
            open = rootCause.path("open").asInt(0);
            plan.add("Patch " + rootCause.path("suspect").asText());
        }

        int applied = open > 0 ? previous + 1 : previous;
        log.info("Refactoring pass {}: {} open items, {} fixes applied in total", context.getIteration(), open, applied);
        return WorkerResult.success()
            .field(FIELD_FIXES_APPLIED, IntNode.valueOf(applied))
            .field(FIELD_REFACTORING_PLAN, plan)
            .build();
    }

    /**
     * Debugger.
     *
     * Every exception or error type named in the argument is a defect; fixes applied
     * so far close them in order.
     */
    static WorkerResult debug(WorkerContext context) throws WorkerException {
        DevelopmentTarget target = DevelopmentTarget.of(context.getArgument());
        if (target.isEmpty()) {
            throw new WorkerException("NO_REPRODUCTION", "Nothing to reproduce: the failure description is empty");
        }
        int fixes = context.getInput(FIELD_FIXES_APPLIED).map(JsonNode::asInt).orElse(0);

        List<String> defects = new ArrayList<>(target.tokensEndingWith("exception"));
        defects.addAll(target.tokensEndingWith("error"));
        if (defects.isEmpty()) {
            defects.add("unclassified-failure");
        }
        int open = Math.max(0, defects.size() - fixes);

        ObjectNode rootCause = mapper.createObjectNode()
            .put("suspect", defects.get(0))
            .put("open", open)
            .put("resolved", open == 0);
        ArrayNode defectList = rootCause.putArray("defects");
        defects.forEach(defectList::add);

        Diagnostics.Builder diagnostics = Diagnostics.builder();
        for (String defect : defects.subList(defects.size() - open, defects.size())) {
            diagnostics.entry(Severity.CRITICAL, "UNRESOLVED_DEFECT", defect + " still reproduces");
        }
        if (open == 0) {
            diagnostics.entry(Severity.INFO, "FIX_VERIFIED", "No defect reproduces after " + fixes + " fixes");
        }

        log.info("Debugging '{}': {} defects, {} still open", target.describe(), defects.size(), open);
        WorkerResult.Builder result = open == 0 ? WorkerResult.success() : WorkerResult.needsFollowUp();
        return result
            .field(FIELD_ROOT_CAUSE, rootCause)
            .diagnostics(diagnostics.build())
            .build();
    }

    // ========== Analysis ==========

    /**
     * Security Auditor.
     */
    static WorkerResult auditSecurity(WorkerContext context) {
        DevelopmentTarget target = DevelopmentTarget.of(context.getArgument());
        ObjectNode report = mapper.createObjectNode().put("target", target.describe());
        ArrayNode issues = report.putArray("issues");
        Diagnostics.Builder diagnostics = Diagnostics.builder();

        if (target.mentions("sql")) {
            addFinding(issues, diagnostics, Severity.CRITICAL, "SQL_INJECTION",
                "Queries in " + target.describe() + " must use bound parameters");
        }
        if (!target.mentioned(List.of("password", "secret", "credential", "token")).isEmpty()) {
            addFinding(issues, diagnostics, Severity.HIGH, "SECRET_HANDLING",
                "Secrets must come from the environment, not from source");
        }
        if (!target.mentioned(List.of("auth", "login", "session")).isEmpty()) {
            addFinding(issues, diagnostics, Severity.MEDIUM, "AUTH_FLOW",
                "Authentication flow needs a second reviewer");
        }
        if (issues.isEmpty()) {
            diagnostics.entry(Severity.INFO, "NO_FINDINGS", "No security findings");
        }
        report.put("passed", issues.isEmpty());

        return WorkerResult.success()
            .field(FIELD_SECURITY_REPORT, report)
            .diagnostics(diagnostics.build())
            .build();
    }

    /**
     * Performance Analyzer.
     */
    static WorkerResult analyzePerformance(WorkerContext context) {
        DevelopmentTarget target = DevelopmentTarget.of(context.getArgument());
        ObjectNode report = mapper.createObjectNode().put("target", target.describe());
        ArrayNode issues = report.putArray("issues");
        Diagnostics.Builder diagnostics = Diagnostics.builder();

        if (!target.mentioned(List.of("slow", "latency", "timeout")).isEmpty()) {
            addFinding(issues, diagnostics, Severity.HIGH, "HOT_PATH",
                "Reported latency points at a hot path in " + target.describe());
        }
        if (!target.mentioned(List.of("query", "queries", "loop")).isEmpty()) {
            addFinding(issues, diagnostics, Severity.MEDIUM, "N_PLUS_ONE",
                "Queries issued inside a loop; batch them");
        }
        if (target.mentions("cache")) {
            addFinding(issues, diagnostics, Severity.LOW, "CACHE_POLICY",
                "Cache has no eviction policy");
        }
        if (issues.isEmpty()) {
            diagnostics.entry(Severity.INFO, "NO_FINDINGS", "No performance findings");
        }

        return WorkerResult.success()
            .field(FIELD_PERFORMANCE_REPORT, report)
            .diagnostics(diagnostics.build())
            .build();
    }

    // ========== Design & Implementation ==========

    /**
     * API Designer.
     *
     * Exposes list, create and get endpoints for every plural noun of the argument.
     */
    static WorkerResult designApi(WorkerContext context) throws WorkerException {
        DevelopmentTarget target = DevelopmentTarget.of(context.getArgument());
        List<String> resources = target.resources();
        if (resources.isEmpty()) {
            throw new WorkerException("EMPTY_DESIGN", "No resources found in '" + target.describe() + "'");
        }

        ObjectNode spec = mapper.createObjectNode().put("version", "v1");
        ArrayNode resourceList = spec.putArray("resources");
        ArrayNode endpoints = spec.putArray("endpoints");
        for (String resource : resources) {
            resourceList.add(resource);
            endpoints.addObject().put("method", "GET").put("path", "/" + resource);
            endpoints.addObject().put("method", "POST").put("path", "/" + resource);
            endpoints.addObject().put("method", "GET").put("path", "/" + resource + "/{id}");
        }

        return WorkerResult.success()
            .field(FIELD_API_SPEC, spec)
            .diagnostics(Diagnostics.builder()
                .entry(Severity.INFO, "API_DESIGNED", endpoints.size() + " endpoints for " + resources)
                .build())
            .build();
    }

    /**
     * Backend Implementer.
     */
    static WorkerResult implementBackend(WorkerContext context) {
        JsonNode spec = context.getInput(FIELD_API_SPEC).orElseThrow();
        ArrayNode modules = mapper.createArrayNode();
        for (JsonNode resource : spec.path("resources")) {
            String type = DevelopmentTarget.capitalize(DevelopmentTarget.singular(resource.asText()));
            modules.add(type + "Controller");
            modules.add(type + "Service");
            modules.add(type + "Repository");
        }
        return WorkerResult.success()
            .field(FIELD_BACKEND_MODULES, modules)
            .build();
    }

    /**
     * Frontend Implementer.
     */
    static WorkerResult implementFrontend(WorkerContext context) {
        JsonNode spec = context.getInput(FIELD_API_SPEC).orElseThrow();
        JsonNode tokens = context.getInput(FIELD_DESIGN_TOKENS).orElse(mapper.createObjectNode());

        ObjectNode frontend = mapper.createObjectNode()
            .put("theme", tokens.path("primaryColor").asText("default"));
        ArrayNode components = frontend.putArray("components");
        for (JsonNode resource : spec.path("resources")) {
            String type = DevelopmentTarget.capitalize(DevelopmentTarget.singular(resource.asText()));
            components.add(type + "List");
            components.add(type + "Form");
        }
        return WorkerResult.success()
            .field(FIELD_FRONTEND_COMPONENTS, frontend)
            .build();
    }

    /**
     * Visual Design Extractor.
     */
    static WorkerResult extractVisualDesign(WorkerContext context) {
        DevelopmentTarget target = DevelopmentTarget.of(context.getArgument());
        ObjectNode tokens = mapper.createObjectNode()
            .put("source", target.describe())
            .put("primaryColor", target.mentions("dark") ? "#1e1e2e" : "#3366ff")
            .put("fontFamily", target.mentions("serif") ? "Georgia" : "Inter")
            .put("spacingUnit", 8);
        return WorkerResult.success()
            .field(FIELD_DESIGN_TOKENS, tokens)
            .build();
    }

    // ========== Tests & Docs ==========

    /**
     * Test Generator.
     *
     * One contract test per endpoint, one regression test per defect, one render test per
     * component; a smoke test when none of these inputs exist.
     */
    static WorkerResult generateTests(WorkerContext context) {
        DevelopmentTarget target = DevelopmentTarget.of(context.getArgument());
        ArrayNode cases = mapper.createArrayNode();

        context.getInput(FIELD_API_SPEC).ifPresent(spec -> {
            for (JsonNode endpoint : spec.path("endpoints")) {
                cases.add("contract: " + endpoint.path("method").asText() + " " + endpoint.path("path").asText());
            }
        });
        context.getInput(FIELD_ROOT_CAUSE).ifPresent(rootCause -> {
            for (JsonNode defect : rootCause.path("defects")) {
                cases.add("regression: " + defect.asText() + " does not recur");
            }
        });
        context.getInput(FIELD_FRONTEND_COMPONENTS).ifPresent(frontend -> {
            for (JsonNode component : frontend.path("components")) {
                cases.add("ui: renders " + component.asText());
            }
        });
        if (cases.isEmpty()) {
            cases.add("smoke: " + target.describe() + " starts");
        }

        ObjectNode suite = mapper.createObjectNode().put("name", context.getWorkflowName() + "-tests");
        suite.set("cases", cases);
        return WorkerResult.success()
            .field(FIELD_TEST_SUITE, suite)
            .diagnostics(Diagnostics.builder().count(COUNT_TESTS_GENERATED, cases.size()).build())
            .build();
    }

    /**
     * Documentation Writer.
     *
     * Fails (without failing critical phases, as it is advisory) when there is nothing to document.
     */
    static WorkerResult writeDocumentation(WorkerContext context) {
        DevelopmentTarget target = DevelopmentTarget.of(context.getArgument());
        if (target.isEmpty() && context.getInputs().isEmpty()) {
            return WorkerResult.failure("NOTHING_TO_DOCUMENT", "No target and no upstream results to document").build();
        }

        ArrayNode sections = mapper.createArrayNode();
        sections.add("Overview of " + target.describe());
        context.getInput(FIELD_API_SPEC).ifPresent(spec ->
            sections.add("API Reference (" + spec.path("endpoints").size() + " endpoints)"));
        context.getInput(FIELD_TEST_SUITE).ifPresent(suite ->
            sections.add("Testing (" + suite.path("cases").size() + " cases)"));
        context.getInput(FIELD_REVIEW_FINDINGS)
            .filter(findings -> findings.size() > 0)
            .ifPresent(findings -> sections.add("Known Issues (" + findings.size() + ")"));
        context.getInput(FIELD_SECURITY_REPORT).ifPresent(report ->
            sections.add("Security Notes (" + report.path("issues").size() + " findings)"));

        ObjectNode documentation = mapper.createObjectNode().put("title", target.describe());
        documentation.set("sections", sections);
        return WorkerResult.success()
            .field(FIELD_DOCUMENTATION, documentation)
            .build();
    }

    private static void addFinding(ArrayNode issues, Diagnostics.Builder diagnostics,
                                   Severity severity, String code, String message) {
        issues.addObject().put("code", code).put("severity", severity.name()).put("message", message);
        diagnostics.entry(severity, code, message);
    }
}

package com.agentflow.engine.test;

import com.agentflow.core.exception.RunNotTerminalException;
import com.agentflow.core.exception.UnknownWorkerException;
import com.agentflow.core.model.*;
import com.agentflow.engine.aggregation.OutcomeAggregator;
import com.agentflow.engine.metrics.WorkflowMetrics;
import com.agentflow.worker.WorkerResult;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.agentflow.engine.test.ScriptedWorker.withCritical;
import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end scenarios for the orchestrator: chains, fan-out, validation loops and failures.
 * Workers are scripted in-process; no Spring context is involved.
 */
public class WorkflowScenarioTest {

    private EngineHarness harness;

    @BeforeEach
    void setUp() {
        harness = EngineHarness.create();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        harness.close();
    }

    // ========== Composition ==========

    @Test
    @DisplayName("Sequential chain passes output of the first phase to the second")
    void testSequentialChain() {
        ScriptedWorker writer = ScriptedWorker.returning(ctx -> WorkerResult.success()
            .field("docs", "Docs for " + ctx.getInput("summary").orElseThrow().asText())
            .build());
        harness.register("analyzer", ScriptedWorker.producing("summary", "3 modules"), "analysis");
        harness.register(WorkerDescriptor.builder()
            .id("writer")
            .capabilities("documentation")
            .input(FieldSpec.required("summary"))
            .outputs("docs")
            .build(), writer);

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("chain")
            .phase(PhaseDefinition.builder("analyze").workers("analyzer").build())
            .phase(PhaseDefinition.builder("document").workers("writer").build())
            .build();

        FinalResult result = harness.orchestrator().runWorkflow(definition, "src/", RunOptions.defaults());

        assertThat(result.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(result.exitCode()).isZero();
        assertThat(result.phases()).extracting(PhaseSummary::phaseId).containsExactly("analyze", "document");
        assertThat(writer.getInvocations()).singleElement()
            .satisfies(inv -> {
                assertThat(inv.inputs().get("summary").asText()).isEqualTo("3 modules");
                assertThat(inv.argument()).isEqualTo("src/");
            });
        assertThat(result.getPhase("document").outcomes().get(0).producedFields().get("docs").asText())
            .isEqualTo("Docs for 3 modules");

        WorkflowRun run = harness.orchestrator().getRun(result.runId());
        assertThat(run.contextBus().read("docs").asText()).isEqualTo("Docs for 3 modules");
    }

    @Test
    @DisplayName("Four sequential phases that all succeed are reported in declaration order")
    void testQualitySprintWithoutLoops() {
        harness.register("reviewer", ScriptedWorker.succeeding())
            .register("refactorer", ScriptedWorker.succeeding())
            .register("tester", ScriptedWorker.succeeding())
            .register("documenter", ScriptedWorker.succeeding());

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("quality-sprint")
            .phase(PhaseDefinition.builder("review").workers("reviewer").build())
            .phase(PhaseDefinition.builder("refactor").workers("refactorer").build())
            .phase(PhaseDefinition.builder("test").workers("tester").build())
            .phase(PhaseDefinition.builder("document").workers("documenter").build())
            .build();

        FinalResult result = harness.orchestrator().runWorkflow(definition, "src/", RunOptions.defaults());

        assertThat(result.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(result.phases()).extracting(PhaseSummary::phaseId)
            .containsExactly("review", "refactor", "test", "document");
        assertThat(result.phases()).extracting(PhaseSummary::status)
            .containsOnly(PhaseStatus.SUCCEEDED);
    }

    @Test
    @DisplayName("Parallel phase dispatches concurrently and reports outcomes in declaration order")
    void testParallelFanOut() {
        ScriptedWorker slow = ScriptedWorker.producing("slowResult", "s").withDelay(Duration.ofMillis(300));
        ScriptedWorker medium = ScriptedWorker.producing("mediumResult", "m").withDelay(Duration.ofMillis(100));
        ScriptedWorker fast = ScriptedWorker.producing("fastResult", "f");
        harness.register("slow", slow).register("medium", medium).register("fast", fast);

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("fan-out")
            .phase(PhaseDefinition.builder("implement").workers("slow", "medium", "fast").parallel(true).build())
            .build();

        FinalResult result = harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults());

        assertThat(result.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(result.getPhase("implement").outcomes())
            .extracting(WorkerOutcome::workerId)
            .containsExactly("slow", "medium", "fast");

        long firstStart = List.of(slow, medium, fast).stream()
            .mapToLong(w -> w.getInvocations().get(0).startedAtNanos()).min().orElseThrow();
        long lastStart = List.of(slow, medium, fast).stream()
            .mapToLong(w -> w.getInvocations().get(0).startedAtNanos()).max().orElseThrow();
        assertThat(Duration.ofNanos(lastStart - firstStart)).isLessThan(Duration.ofMillis(250));

        WorkflowRun run = harness.orchestrator().getRun(result.runId());
        assertThat(run.contextBus().entries())
            .extracting(e -> e.key().workerId())
            .containsExactly("slow", "medium", "fast");
    }

    @Test
    @DisplayName("Capability reference resolves to the first registered worker with the tag")
    void testCapabilityReference() {
        ScriptedWorker first = ScriptedWorker.succeeding();
        ScriptedWorker second = ScriptedWorker.succeeding();
        harness.register("reviewer-a", first, "code-review").register("reviewer-b", second, "code-review");

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("by-capability")
            .phase(PhaseDefinition.builder("review").workers("capability:code-review").build())
            .build();

        FinalResult result = harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults());

        assertThat(result.getPhase("review").outcomes()).extracting(WorkerOutcome::workerId)
            .containsExactly("reviewer-a");
        assertThat(second.getInvocationCount()).isZero();
    }

    @Test
    @DisplayName("Declared default applies when an optional input was never written")
    void testInputDefault() {
        ScriptedWorker formatter = ScriptedWorker.succeeding();
        harness.register(WorkerDescriptor.builder()
            .id("formatter")
            .input(FieldSpec.withDefault("style", TextNode.valueOf("google")))
            .input(FieldSpec.optional("previousReport"))
            .build(), formatter);

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("defaults")
            .phase(PhaseDefinition.builder("format").workers("formatter").build())
            .build();

        harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults());

        assertThat(formatter.getInvocations().get(0).inputs())
            .containsEntry("style", TextNode.valueOf("google"))
            .doesNotContainKey("previousReport");
    }

    // ========== Validation Loops ==========

    @Test
    @DisplayName("Review loop re-enters the phase until no critical findings remain")
    void testValidationLoopConverges() {
        ScriptedWorker reviewer = ScriptedWorker.returning(
            ctx -> withCritical(2),
            ctx -> withCritical(1),
            ctx -> withCritical(0));
        ScriptedWorker fixer = ScriptedWorker.succeeding();
        harness.register("reviewer", reviewer, "code-review").register("fixer", fixer, "refactoring");

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("review-loop")
            .phase(PhaseDefinition.builder("review-fix")
                .workers("reviewer", "fixer")
                .loopUntil(LoopCondition.countEquals("criticalCount", 0), 5)
                .build())
            .build();

        FinalResult result = harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults());

        PhaseSummary phase = result.getPhase("review-fix");
        assertThat(phase.status()).isEqualTo(PhaseStatus.SUCCEEDED);
        assertThat(phase.iterations()).isEqualTo(3);
        assertThat(phase.outcomes()).hasSize(6);
        assertThat(reviewer.getInvocations()).extracting(ScriptedWorker.Invocation::iteration)
            .containsExactly(1, 2, 3);
        assertThat(result.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(result.severityCounts()).containsEntry(Severity.CRITICAL, 3L);
    }

    @Test
    @DisplayName("Loop that never converges stops at the cap, degrades the phase and lets the run advance")
    void testValidationLoopHitsCap() {
        ScriptedWorker reviewer = ScriptedWorker.returning(ctx -> withCritical(1));
        ScriptedWorker writer = ScriptedWorker.succeeding();
        harness.register("reviewer", reviewer).register("writer", writer);

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("stubborn-loop")
            .phase(PhaseDefinition.builder("review")
                .workers("reviewer")
                .loopUntil(LoopCondition.parse("diagnostics.criticalCount == 0"), 3)
                .build())
            .phase(PhaseDefinition.builder("document").workers("writer").build())
            .build();

        FinalResult result = harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults());

        assertThat(reviewer.getInvocationCount()).isEqualTo(3);
        assertThat(result.getPhase("review").status()).isEqualTo(PhaseStatus.PARTIALLY_FAILED);
        assertThat(result.getPhase("review").failureReason()).contains("criticalCount == 0");
        assertThat(result.getPhase("document").status()).isEqualTo(PhaseStatus.SUCCEEDED);
        assertThat(result.status()).isEqualTo(RunStatus.PARTIALLY_FAILED);
        assertThat(result.exitCode()).isEqualTo(2);
    }

    @Test
    @DisplayName("Run-level iteration override replaces the phase cap")
    void testMaxIterationsOverride() {
        ScriptedWorker reviewer = ScriptedWorker.returning(ctx -> withCritical(1));
        harness.register("reviewer", reviewer);

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("override")
            .phase(PhaseDefinition.builder("review")
                .workers("reviewer")
                .loopUntil(LoopCondition.countEquals("criticalCount", 0), 2)
                .build())
            .build();

        FinalResult result = harness.orchestrator()
            .runWorkflow(definition, null, RunOptions.defaults().withMaxIterations(4));

        assertThat(result.getPhase("review").iterations()).isEqualTo(4);
        assertThat(reviewer.getInvocationCount()).isEqualTo(4);
    }

    // ========== Failures ==========

    @Test
    @DisplayName("Critical worker failure fails the phase, skips the rest and fails the run")
    void testCriticalFailureAbortsRun() {
        ScriptedWorker tester = ScriptedWorker.succeeding();
        harness.register("compiler", ScriptedWorker.failing("BUILD_BROKEN"))
            .register("linter", ScriptedWorker.succeeding())
            .register("tester", tester);

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("broken-build")
            .phase(PhaseDefinition.builder("build").workers("compiler", "linter").parallel(true).build())
            .phase(PhaseDefinition.builder("test").workers("tester").build())
            .build();

        FinalResult result = harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults());

        assertThat(result.getPhase("build").status()).isEqualTo(PhaseStatus.FAILED);
        assertThat(result.getPhase("test").status()).isEqualTo(PhaseStatus.SKIPPED);
        assertThat(tester.getInvocationCount()).isZero();
        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.failures()).singleElement()
            .satisfies(f -> {
                assertThat(f.phaseId()).isEqualTo("build");
                assertThat(f.workerId()).isEqualTo("compiler");
                assertThat(f.errorCode()).isEqualTo("BUILD_BROKEN");
            });
    }

    @Test
    @DisplayName("Sequential phase short-circuits on the first failure and lists skipped workers")
    void testSequentialShortCircuit() {
        ScriptedWorker second = ScriptedWorker.succeeding();
        harness.register("first", ScriptedWorker.throwing("LINT_FAILED"))
            .register("second", second)
            .register("third", ScriptedWorker.succeeding());

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("short-circuit")
            .phase(PhaseDefinition.builder("checks").workers("first", "second", "third").build())
            .build();

        FinalResult result = harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults());

        PhaseSummary checks = result.getPhase("checks");
        assertThat(checks.outcomes()).singleElement()
            .satisfies(o -> assertThat(o.errorCode()).isEqualTo("LINT_FAILED"));
        assertThat(checks.skippedWorkers()).containsExactly("second", "third");
        assertThat(second.getInvocationCount()).isZero();
    }

    @Test
    @DisplayName("Advisory worker failure only degrades the phase")
    void testAdvisoryFailure() {
        harness.register("implementer", ScriptedWorker.succeeding())
            .register(WorkerDescriptor.builder().id("style-checker").advisory().build(),
                ScriptedWorker.failing("STYLE"));

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("advisory")
            .phase(PhaseDefinition.builder("implement").workers("implementer", "style-checker").parallel(true).build())
            .build();

        FinalResult result = harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults());

        assertThat(result.getPhase("implement").status()).isEqualTo(PhaseStatus.PARTIALLY_FAILED);
        assertThat(result.status()).isEqualTo(RunStatus.PARTIALLY_FAILED);
        assertThat(result.failures()).extracting(RunFailure::workerId).containsExactly("style-checker");
    }

    @Test
    @DisplayName("Unknown worker reference is rejected before any run executes")
    void testUnknownWorkerRejectedUpFront() {
        ScriptedWorker reviewer = ScriptedWorker.succeeding();
        harness.register("reviewer", reviewer);

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("typo")
            .phase(PhaseDefinition.builder("review").workers("reviewer").build())
            .phase(PhaseDefinition.builder("fix").workers("refactorer").build())
            .build();

        assertThatThrownBy(() -> harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults()))
            .isInstanceOf(UnknownWorkerException.class)
            .hasMessageContaining("refactorer");
        assertThat(reviewer.getInvocationCount()).isZero();
        assertThat(harness.runs().findByWorkflow("typo", 10)).isEmpty();
    }

    @Test
    @DisplayName("Capability reference without a provider is an unknown worker")
    void testUnresolvedCapability() {
        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("no-provider")
            .phase(PhaseDefinition.builder("audit").workers("capability:security-review").build())
            .build();

        assertThatThrownBy(() -> harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults()))
            .isInstanceOf(UnknownWorkerException.class)
            .hasMessageContaining("security-review");
    }

    @Test
    @DisplayName("Missing required input is fatal and recorded as a run failure")
    void testMissingContextFailsRun() {
        ScriptedWorker implementer = ScriptedWorker.succeeding();
        harness.register(WorkerDescriptor.builder()
            .id("implementer")
            .input(FieldSpec.required("apiSpec"))
            .build(), implementer);

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("missing-design")
            .phase(PhaseDefinition.builder("implement").workers("implementer").build())
            .build();

        FinalResult result = harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults());

        assertThat(implementer.getInvocationCount()).isZero();
        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
        assertThat(result.failures()).singleElement()
            .satisfies(f -> {
                assertThat(f.errorCode()).isEqualTo("MISSING_CONTEXT");
                assertThat(f.workerId()).isEqualTo("implementer");
            });
    }

    @Test
    @DisplayName("Writing the same context key twice is fatal")
    void testKeyCollisionFailsRun() {
        harness.register("writer", ScriptedWorker.producing("notes", "n"));

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("collision")
            .phase(PhaseDefinition.builder("notes").workers("writer", "writer").parallel(true).build())
            .build();

        FinalResult result = harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults());

        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
        assertThat(result.failures()).extracting(RunFailure::errorCode).containsExactly("KEY_COLLISION");
        assertThat(harness.meterRegistry().get(WorkflowMetrics.KEY_COLLISIONS).counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Worker exceeding its deadline becomes a TIMEOUT failure without crashing the run")
    void testWorkerTimeout() {
        harness.register(WorkerDescriptor.builder().id("hanging").timeout(Duration.ofMillis(100)).build(),
            ScriptedWorker.succeeding().withDelay(Duration.ofSeconds(3)));

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("slow")
            .phase(PhaseDefinition.builder("wait").workers("hanging").build())
            .build();

        long start = System.nanoTime();
        FinalResult result = harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults());

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));
        WorkerOutcome outcome = result.getPhase("wait").outcomes().get(0);
        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILURE);
        assertThat(outcome.errorCode()).isEqualTo("TIMEOUT");
        assertThat(outcome.diagnostics().entries()).extracting(DiagnosticEntry::code).contains("TIMEOUT");
        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
        assertThat(harness.meterRegistry().get(WorkflowMetrics.WORKER_TIMEOUTS).counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Time spent queued behind a saturated worker pool does not count against the deadline")
    void testDeadlineStartsWhenWorkerRuns() {
        // Wider than the harness's 8-thread pool: the last two workers wait for a free thread
        String[] ids = new String[10];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = "w" + i;
            harness.register(WorkerDescriptor.builder().id(ids[i]).timeout(Duration.ofMillis(600)).build(),
                ScriptedWorker.succeeding().withDelay(Duration.ofMillis(400)));
        }

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("wide")
            .phase(PhaseDefinition.builder("fan-out").workers(ids).parallel(true).build())
            .build();

        FinalResult result = harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults());

        assertThat(result.getPhase("fan-out").outcomes())
            .hasSize(10)
            .extracting(WorkerOutcome::status)
            .containsOnly(OutcomeStatus.SUCCESS);
        assertThat(result.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(harness.meterRegistry().find(WorkflowMetrics.WORKER_TIMEOUTS).counter()).isNull();
    }

    // ========== Termination & Determinism ==========

    @Test
    @DisplayName("Same workflow and same worker behaviour give the same outcomes")
    void testDeterministicOutcomes() {
        harness.register("a", ScriptedWorker.producing("x", "1").withDelay(Duration.ofMillis(50)))
            .register("b", ScriptedWorker.producing("y", "2"))
            .register("c", ScriptedWorker.returning(ctx -> withCritical(0)));

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("repeatable")
            .phase(PhaseDefinition.builder("p1").workers("a", "b").parallel(true).build())
            .phase(PhaseDefinition.builder("p2").workers("c")
                .loopUntil(LoopCondition.countEquals("criticalCount", 0), 3).build())
            .build();

        FinalResult first = harness.orchestrator().runWorkflow(definition, "arg", RunOptions.defaults());
        FinalResult second = harness.orchestrator().runWorkflow(definition, "arg", RunOptions.defaults());

        assertThat(first.status()).isEqualTo(second.status());
        assertThat(project(first)).isEqualTo(project(second));
        assertThat(first.mergedDiagnostics()).isEqualTo(second.mergedDiagnostics());
    }

    @Test
    @DisplayName("Aggregation is idempotent and refuses non-terminal runs")
    void testAggregation() {
        harness.register("a", ScriptedWorker.returning(ctx -> withCritical(2)));
        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("aggregate")
            .phase(PhaseDefinition.builder("p").workers("a").build())
            .build();

        FinalResult result = harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults());

        assertThat(harness.orchestrator().getResult(result.runId()))
            .isEqualTo(harness.orchestrator().getResult(result.runId()))
            .isEqualTo(result);

        WorkflowRun pending = WorkflowRun.create(definition, null, RunOptions.defaults());
        assertThatThrownBy(() -> new OutcomeAggregator().aggregate(pending))
            .isInstanceOf(RunNotTerminalException.class);
    }

    @Test
    @DisplayName("Completed run is counted by terminal status")
    void testRunMetrics() {
        harness.register("a", ScriptedWorker.succeeding());
        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("metered")
            .phase(PhaseDefinition.builder("p").workers("a").build())
            .build();

        harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults());

        assertThat(harness.meterRegistry().get(WorkflowMetrics.RUNS_FINISHED)
            .tag("status", "SUCCEEDED").counter().count()).isEqualTo(1.0);
        assertThat(harness.meterRegistry().get(WorkflowMetrics.WORKER_INVOCATIONS)
            .tag("worker", "a").counter().count()).isEqualTo(1.0);
        assertThat(harness.metrics().getActiveRuns()).isZero();
    }

    private static List<String> project(FinalResult result) {
        List<String> lines = new ArrayList<>();
        for (PhaseSummary phase : result.phases()) {
            for (WorkerOutcome outcome : phase.outcomes()) {
                lines.add(phase.phaseId() + "#" + outcome.iteration() + "/" + outcome.workerId() + " "
                    + outcome.status() + " " + outcome.producedFields());
            }
        }
        return lines;
    }
}

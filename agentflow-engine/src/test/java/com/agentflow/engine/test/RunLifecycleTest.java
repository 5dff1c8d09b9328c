package com.agentflow.engine.test;

import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.model.*;
import com.agentflow.engine.approval.ApprovalGate;
import com.agentflow.engine.approval.SignalApprovalGate;
import com.agentflow.engine.service.WorkflowService.StartRunRequest;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for asynchronous runs, cancellation, focus filtering, interactive gates and follow-ups.
 */
public class RunLifecycleTest {

    private EngineHarness harness;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (harness != null) {
            harness.close();
        }
    }

    // ========== Async & Cancellation ==========

    @Test
    @DisplayName("Started run executes in the background and becomes queryable")
    void testStartRunAsync() throws InterruptedException {
        harness = EngineHarness.create();
        harness.register("writer", ScriptedWorker.producing("docs", "readme"));
        harness.orchestrator().registerWorkflow(WorkflowDefinition.builder()
            .name("docs")
            .phase(PhaseDefinition.builder("write").workers("writer").build())
            .build());

        WorkflowRun started = harness.orchestrator().startRun(StartRunRequest.of("docs", "README.md"));
        WorkflowRun finished = awaitTerminal(started.runId());

        assertThat(finished.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(finished.argument()).isEqualTo("README.md");
        assertThat(harness.orchestrator().listRuns("docs", null, 10))
            .extracting(WorkflowRun::runId)
            .containsExactly(started.runId());
        assertThat(harness.orchestrator().getActiveRunCount()).isZero();
    }

    @Test
    @DisplayName("Cancelling a run stops in-flight workers and skips remaining phases")
    void testCancelRunningRun() throws InterruptedException {
        harness = EngineHarness.create();
        ScriptedWorker blocked = ScriptedWorker.succeeding().blockingOn(new CountDownLatch(1));
        ScriptedWorker after = ScriptedWorker.succeeding();
        harness.register("blocked", blocked).register("after", after);
        harness.orchestrator().registerWorkflow(WorkflowDefinition.builder()
            .name("cancellable")
            .phase(PhaseDefinition.builder("wait").workers("blocked").build())
            .phase(PhaseDefinition.builder("next").workers("after").build())
            .build());

        WorkflowRun started = harness.orchestrator().startRun(StartRunRequest.of("cancellable", null));
        assertThat(blocked.awaitStarted(Duration.ofSeconds(5))).isTrue();

        assertThat(harness.orchestrator().cancelRun(started.runId(), "user abort")).isTrue();
        WorkflowRun finished = awaitTerminal(started.runId());

        assertThat(finished.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(finished.getPhase("next").status()).isEqualTo(PhaseStatus.SKIPPED);
        assertThat(after.getInvocationCount()).isZero();

        FinalResult result = harness.orchestrator().getResult(started.runId());
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.getPhase("wait").outcomes()).singleElement()
            .satisfies(o -> {
                assertThat(o.status()).isEqualTo(OutcomeStatus.FAILURE);
                assertThat(o.errorCode()).isEqualTo(WorkerOutcome.ERROR_CANCELLED);
            });

        assertThat(harness.orchestrator().cancelRun(started.runId(), "again")).isFalse();
    }

    @Test
    @DisplayName("Cancelling an unknown run is a not-found error")
    void testCancelUnknownRun() {
        harness = EngineHarness.create();

        assertThatThrownBy(() -> harness.orchestrator().cancelRun("missing", null))
            .isInstanceOf(NotFoundException.class);
    }

    // ========== Focus ==========

    @Test
    @DisplayName("Focus narrows dispatched workers and skips phases left without workers")
    void testFocusFilter() {
        harness = EngineHarness.create();
        ScriptedWorker security = ScriptedWorker.succeeding();
        ScriptedWorker performance = ScriptedWorker.succeeding();
        ScriptedWorker writer = ScriptedWorker.succeeding();
        harness.register("security-auditor", security, "security-review")
            .register("performance-analyzer", performance, "performance-analysis")
            .register("documentation-writer", writer, "documentation");

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("audit")
            .phase(PhaseDefinition.builder("audit")
                .workers("security-auditor", "performance-analyzer").parallel(true).build())
            .phase(PhaseDefinition.builder("document").workers("documentation-writer").build())
            .build();

        FinalResult result = harness.orchestrator()
            .runWorkflow(definition, null, RunOptions.defaults().withFocus(Focus.SECURITY));

        assertThat(security.getInvocationCount()).isEqualTo(1);
        assertThat(performance.getInvocationCount()).isZero();
        assertThat(writer.getInvocationCount()).isZero();
        assertThat(result.getPhase("document").status()).isEqualTo(PhaseStatus.SKIPPED);
        assertThat(result.getPhase("document").failureReason()).contains("focus");
        assertThat(result.status()).isEqualTo(RunStatus.SUCCEEDED);
    }

    // ========== Interactive ==========

    @Test
    @DisplayName("Interactive run asks for approval between phases only")
    void testInteractiveApprovals() {
        List<String> asked = new CopyOnWriteArrayList<>();
        ApprovalGate recording = (run, phaseId) -> {
            asked.add(phaseId);
            return true;
        };
        harness = EngineHarness.withApprovalGate(recording);
        harness.register("a", ScriptedWorker.succeeding()).register("b", ScriptedWorker.succeeding());

        FinalResult result = harness.orchestrator()
            .runWorkflow(twoPhases(), null, RunOptions.defaults().withInteractive(true));

        assertThat(result.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(asked).containsExactly("first");
    }

    @Test
    @DisplayName("Declined approval cancels the run and skips the rest")
    void testInteractiveDecline() {
        harness = EngineHarness.withApprovalGate((run, phaseId) -> false);
        ScriptedWorker second = ScriptedWorker.succeeding();
        harness.register("a", ScriptedWorker.succeeding()).register("b", second);

        FinalResult result = harness.orchestrator()
            .runWorkflow(twoPhases(), null, RunOptions.defaults().withInteractive(true));

        assertThat(result.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(result.getPhase("first").status()).isEqualTo(PhaseStatus.SUCCEEDED);
        assertThat(result.getPhase("second").status()).isEqualTo(PhaseStatus.SKIPPED);
        assertThat(second.getInvocationCount()).isZero();
    }

    @Test
    @DisplayName("Signalled approval releases a waiting run")
    void testSignalledApproval() throws InterruptedException {
        SignalApprovalGate gate = new SignalApprovalGate(Duration.ofSeconds(10));
        harness = EngineHarness.withApprovalGate(gate);
        harness.register("a", ScriptedWorker.succeeding()).register("b", ScriptedWorker.succeeding());
        harness.orchestrator().registerWorkflow(twoPhases());

        WorkflowRun started = harness.orchestrator().startRun(
            new StartRunRequest("two-phases", null, RunOptions.defaults().withInteractive(true)));

        long deadline = System.currentTimeMillis() + 5000;
        while (!gate.isWaiting(started.runId(), "first") && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        harness.orchestrator().decideApproval(started.runId(), "first", true);

        assertThat(awaitTerminal(started.runId()).status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThatThrownBy(() -> harness.orchestrator().decideApproval(started.runId(), "first", true))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Shutdown cancels a run waiting at an approval gate without waiting for the gate timeout")
    void testShutdownReleasesApprovalGate() throws InterruptedException {
        SignalApprovalGate gate = new SignalApprovalGate(Duration.ofMinutes(30));
        harness = EngineHarness.withApprovalGate(gate);
        ScriptedWorker second = ScriptedWorker.succeeding();
        harness.register("a", ScriptedWorker.succeeding()).register("b", second);
        harness.orchestrator().registerWorkflow(twoPhases());

        WorkflowRun started = harness.orchestrator().startRun(
            new StartRunRequest("two-phases", null, RunOptions.defaults().withInteractive(true)));

        long deadline = System.currentTimeMillis() + 5000;
        while (!gate.isWaiting(started.runId(), "first") && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(gate.isWaiting(started.runId(), "first")).isTrue();

        harness.shutdownHandler().shutdown();

        WorkflowRun finished = awaitTerminal(started.runId());
        assertThat(finished.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(second.getInvocationCount()).isZero();
    }

    // ========== Follow-ups ==========

    @Test
    @DisplayName("Completed workers produce follow-ups for workers triggered by them")
    void testFollowUps() {
        harness = EngineHarness.create();
        harness.register("backend-implementer", ScriptedWorker.succeeding())
            .registerTriggered("test-generator",
                TriggerPredicate.on(EventKind.WORKER_COMPLETED, Event.FIELD_WORKER_ID, "-implementer$"))
            .registerTriggered("code-reviewer",
                TriggerPredicate.on(EventKind.WORKER_COMPLETED, Event.FIELD_WORKER_ID, "-implementer$")
                    .requiringConfirmation());

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("implement")
            .phase(PhaseDefinition.builder("build").workers("backend-implementer").build())
            .build();

        FinalResult result = harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults());

        assertThat(result.followUps()).hasSize(2);
        assertThat(result.followUps())
            .allSatisfy(f -> {
                assertThat(f.completedWorkerId()).isEqualTo("backend-implementer");
                assertThat(f.phaseId()).isEqualTo("build");
            });
        assertThat(result.followUps())
            .extracting(FollowUp::workerId, FollowUp::mode)
            .containsExactlyInAnyOrder(
                tuple("test-generator", TriggerMode.AUTOMATIC),
                tuple("code-reviewer", TriggerMode.CONFIRM));
    }

    // ========== Helpers ==========

    private static WorkflowDefinition twoPhases() {
        return WorkflowDefinition.builder()
            .name("two-phases")
            .phase(PhaseDefinition.builder("first").workers("a").build())
            .phase(PhaseDefinition.builder("second").workers("b").build())
            .build();
    }

    private WorkflowRun awaitTerminal(String runId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        WorkflowRun run = harness.orchestrator().getRun(runId);
        while (!run.isTerminal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            run = harness.orchestrator().getRun(runId);
        }
        assertThat(run.isTerminal()).as("run %s reached a terminal status", runId).isTrue();
        return run;
    }
}

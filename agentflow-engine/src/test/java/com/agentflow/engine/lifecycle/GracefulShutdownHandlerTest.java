package com.agentflow.engine.lifecycle;

import com.agentflow.core.exception.ShutdownInProgressException;
import com.agentflow.core.model.PhaseDefinition;
import com.agentflow.core.model.RunOptions;
import com.agentflow.core.model.RunStatus;
import com.agentflow.core.model.WorkflowDefinition;
import com.agentflow.core.model.WorkflowRun;
import com.agentflow.engine.service.WorkflowService.StartRunRequest;
import com.agentflow.engine.test.EngineHarness;
import com.agentflow.engine.test.ScriptedWorker;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GracefulShutdownHandlerTest {

    @Test
    void shutdown_shouldCancelRunsStillActiveAfterGracePeriod() {
        GracefulShutdownHandler handler = new GracefulShutdownHandler(Duration.ofMillis(50));
        List<String> reasons = new ArrayList<>();
        handler.registerActiveRun("run-1", reasons::add);

        handler.shutdown();

        assertThat(reasons).containsExactly("shutdown");
        assertThat(handler.isShuttingDown()).isTrue();
        assertThat(handler.canAcceptRuns()).isFalse();
    }

    @Test
    void shutdown_shouldNotCancelRunsThatFinished() {
        GracefulShutdownHandler handler = new GracefulShutdownHandler(Duration.ofMillis(50));
        List<String> reasons = new ArrayList<>();
        handler.registerActiveRun("run-1", reasons::add);
        handler.unregisterActiveRun("run-1");

        handler.shutdown();

        assertThat(reasons).isEmpty();
        assertThat(handler.getActiveRunCount()).isZero();
    }

    @Test
    void registerActiveRun_shouldFailDuringShutdown() {
        GracefulShutdownHandler handler = new GracefulShutdownHandler(Duration.ZERO);
        handler.shutdown();

        assertThatThrownBy(() -> handler.registerActiveRun("late", reason -> { }))
            .isInstanceOf(ShutdownInProgressException.class);
    }

    @Test
    void shutdown_shouldCancelExecutingOrchestratorRun() throws Exception {
        try (EngineHarness harness = EngineHarness.create()) {
            ScriptedWorker blocked = ScriptedWorker.succeeding().blockingOn(new CountDownLatch(1));
            harness.register("blocked", blocked);
            WorkflowDefinition definition = WorkflowDefinition.builder()
                .name("long-running")
                .phase(PhaseDefinition.builder("wait").workers("blocked").build())
                .build();
            harness.orchestrator().registerWorkflow(definition);

            WorkflowRun started = harness.orchestrator().startRun(StartRunRequest.of("long-running", null));
            assertThat(blocked.awaitStarted(Duration.ofSeconds(5))).isTrue();

            harness.shutdownHandler().shutdown();

            long deadline = System.currentTimeMillis() + 5000;
            WorkflowRun run = harness.orchestrator().getRun(started.runId());
            while (!run.isTerminal() && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
                run = harness.orchestrator().getRun(started.runId());
            }
            assertThat(run.status()).isEqualTo(RunStatus.CANCELLED);
            assertThatThrownBy(() -> harness.orchestrator().runWorkflow(definition, null, RunOptions.defaults()))
                .isInstanceOf(ShutdownInProgressException.class);
        }
    }
}

package com.agentflow.engine.aggregation;

import com.agentflow.core.exception.RunNotTerminalException;
import com.agentflow.core.model.Diagnostics;
import com.agentflow.core.model.FinalResult;
import com.agentflow.core.model.PhaseRecord;
import com.agentflow.core.model.PhaseSummary;
import com.agentflow.core.model.WorkflowRun;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds a terminal run into its final result.
 * Pure: reads only the run snapshot, so aggregating the same run twice gives equal results.
 */
@Component
public class OutcomeAggregator {

    /**
     * Aggregate a terminal run.
     *
     * @throws RunNotTerminalException if the run is still pending or running
     */
    public FinalResult aggregate(WorkflowRun run) {
        if (!run.isTerminal()) {
            throw new RunNotTerminalException(run.runId(), run.status());
        }

        List<PhaseSummary> summaries = new ArrayList<>();
        List<Diagnostics> phaseDiagnostics = new ArrayList<>();
        for (PhaseRecord record : run.phases().values()) {
            PhaseSummary summary = PhaseSummary.of(record);
            summaries.add(summary);
            phaseDiagnostics.add(summary.diagnostics());
        }
        Diagnostics merged = Diagnostics.mergeAll(phaseDiagnostics);

        return new FinalResult(
            run.runId(),
            run.workflowName(),
            run.status(),
            summaries,
            merged,
            merged.severityCounts(),
            run.failures(),
            run.followUps(),
            run.startedAt(),
            run.completedAt(),
            run.status().exitCode()
        );
    }
}

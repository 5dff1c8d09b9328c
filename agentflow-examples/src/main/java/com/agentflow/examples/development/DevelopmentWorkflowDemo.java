package com.agentflow.examples.development;

import com.agentflow.core.exception.OrchestratorException;
import com.agentflow.core.model.FinalResult;
import com.agentflow.core.model.Focus;
import com.agentflow.core.model.RunOptions;
import com.agentflow.engine.report.RunReportRenderer;
import com.agentflow.engine.service.WorkflowService.StartRunRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line runner for the development workflows.
 *
 * <pre>
 * DevelopmentWorkflowDemo &lt;workflow&gt; [argument] [--focus=security|performance|quality]
 *                         [--max-iterations=N] [--json]
 * </pre>
 *
 * Prints the run report and exits with the run's exit code
 * (0 succeeded, 2 partially failed, 1 failed or cancelled; 64 for usage errors).
 */
public class DevelopmentWorkflowDemo {

    private static final Logger log = LoggerFactory.getLogger(DevelopmentWorkflowDemo.class);

    static final int EXIT_USAGE = 64;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        String workflow = null;
        String argument = null;
        RunOptions options = RunOptions.defaults();
        boolean json = false;

        for (String arg : args) {
            if (arg.startsWith("--focus=") || arg.startsWith("--max-iterations=")) {
                try {
                    options = applyOption(options, arg);
                } catch (IllegalArgumentException e) {
                    return usage("invalid option " + arg + ": " + e.getMessage());
                }
            } else if (arg.equals("--json")) {
                json = true;
            } else if (workflow == null) {
                workflow = arg;
            } else if (argument == null) {
                argument = arg;
            } else {
                return usage("unexpected argument: " + arg);
            }
        }
        if (workflow == null) {
            return usage("no workflow given; one of " + DevelopmentWorkflows.all().stream()
                .map(w -> w.name()).toList());
        }

        log.info("Running workflow {} on '{}'", workflow, argument);
        try (DevelopmentEngine engine = new DevelopmentEngine(4)) {
            FinalResult result = engine.orchestrator()
                .runWorkflow(new StartRunRequest(workflow, argument, options));
            RunReportRenderer renderer = new RunReportRenderer();
            System.out.println(json ? renderer.renderJson(result) : renderer.renderText(result));
            return result.exitCode();
        } catch (OrchestratorException e) {
            log.error("Workflow {} could not run: [{}] {}", workflow, e.getErrorCode(), e.getMessage());
            return 1;
        }
    }

    private static RunOptions applyOption(RunOptions options, String arg) {
        String value = arg.substring(arg.indexOf('=') + 1);
        if (arg.startsWith("--focus=")) {
            return options.withFocus(Focus.fromString(value));
        }
        int maxIterations = Integer.parseInt(value);
        if (maxIterations < 1) {
            throw new IllegalArgumentException("must be at least 1");
        }
        return options.withMaxIterations(maxIterations);
    }

    private static int usage(String problem) {
        System.err.println("Usage: DevelopmentWorkflowDemo <workflow> [argument] "
            + "[--focus=security|performance|quality] [--max-iterations=N] [--json]");
        System.err.println(problem);
        return EXIT_USAGE;
    }
}

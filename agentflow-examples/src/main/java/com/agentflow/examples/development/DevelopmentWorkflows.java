package com.agentflow.examples.development;

import com.agentflow.core.model.LoopCondition;
import com.agentflow.core.model.PhaseDefinition;
import com.agentflow.core.model.WorkflowDefinition;

import java.util.List;
import java.util.Map;

import static com.agentflow.examples.development.DevelopmentWorkers.*;

/**
 * Named development workflows.
 *
 * <pre>
 * quality-sprint      review (parallel) -> refactor (loop until clean) -> test -> document
 * debug-session       diagnose -> fix (loop until verified) -> regression-test
 * api-first           design -> implement (parallel backend/frontend) -> contract-tests -> docs
 * full-stack-feature  extract-design -> design-api -> implement (parallel) -> review (loop) -> test -> docs
 * </pre>
 *
 * The same workflows ship as YAML in the API module's catalog.
 */
public final class DevelopmentWorkflows {

    public static final String QUALITY_SPRINT = "quality-sprint";
    public static final String DEBUG_SESSION = "debug-session";
    public static final String API_FIRST = "api-first";
    public static final String FULL_STACK_FEATURE = "full-stack-feature";

    public static final String UNTIL_NO_CRITICAL = "diagnostics.criticalCount == 0";
    public static final int MAX_FIX_ITERATIONS = 3;

    private DevelopmentWorkflows() {
    }

    /**
     * All named workflows.
     */
    public static List<WorkflowDefinition> all() {
        return List.of(qualitySprint(), debugSession(), apiFirst(), fullStackFeature());
    }

    /**
     * Parallel review, then refactor and re-review until no critical smell remains.
     */
    public static WorkflowDefinition qualitySprint() {
        return WorkflowDefinition.builder()
            .name(QUALITY_SPRINT)
            .description("Review, refactor until clean, test and document")
            .labels(Map.of("category", "quality"))
            .phase(PhaseDefinition.builder("review")
                .description("Independent reviews of the same target")
                .workers(CODE_REVIEWER, SECURITY_AUDITOR, PERFORMANCE_ANALYZER)
                .parallel(true)
                .build())
            .phase(PhaseDefinition.builder("refactor")
                .description("Fix one finding per pass and re-review")
                .workers(REFACTORING_EXPERT, CODE_REVIEWER)
                .loopUntil(LoopCondition.parse(UNTIL_NO_CRITICAL), MAX_FIX_ITERATIONS)
                .build())
            .phase(PhaseDefinition.builder("test")
                .workers("capability:test-generation")
                .build())
            .phase(PhaseDefinition.builder("document")
                .workers("capability:documentation")
                .build())
            .build();
    }

    /**
     * Reproduce a failure, then patch and re-verify until it no longer reproduces.
     */
    public static WorkflowDefinition debugSession() {
        return WorkflowDefinition.builder()
            .name(DEBUG_SESSION)
            .description("Diagnose, fix until verified and add a regression test")
            .labels(Map.of("category", "debugging"))
            .phase(PhaseDefinition.builder("diagnose")
                .workers(DEBUGGER)
                .build())
            .phase(PhaseDefinition.builder("fix")
                .description("Patch, then let the debugger verify")
                .workers(REFACTORING_EXPERT, DEBUGGER)
                .loopUntil(LoopCondition.parse(UNTIL_NO_CRITICAL), MAX_FIX_ITERATIONS)
                .build())
            .phase(PhaseDefinition.builder("regression-test")
                .workers(TEST_GENERATOR)
                .build())
            .build();
    }

    /**
     * Contract first: both implementations consume the designed API spec.
     */
    public static WorkflowDefinition apiFirst() {
        return WorkflowDefinition.builder()
            .name(API_FIRST)
            .description("Design the API, implement both sides in parallel, verify the contract")
            .labels(Map.of("category", "delivery"))
            .phase(PhaseDefinition.builder("design")
                .workers(API_DESIGNER)
                .build())
            .phase(PhaseDefinition.builder("implement")
                .workers(BACKEND_IMPLEMENTER, FRONTEND_IMPLEMENTER)
                .parallel(true)
                .build())
            .phase(PhaseDefinition.builder("contract-tests")
                .workers(TEST_GENERATOR)
                .build())
            .phase(PhaseDefinition.builder("docs")
                .workers(DOCUMENTATION_WRITER)
                .build())
            .build();
    }

    /**
     * From design assets to a reviewed, tested and documented feature.
     */
    public static WorkflowDefinition fullStackFeature() {
        return WorkflowDefinition.builder()
            .name(FULL_STACK_FEATURE)
            .description("Extract the design, implement both sides, review until clean, test and document")
            .labels(Map.of("category", "delivery"))
            .phase(PhaseDefinition.builder("extract-design")
                .workers(VISUAL_DESIGN_EXTRACTOR)
                .build())
            .phase(PhaseDefinition.builder("design-api")
                .workers(API_DESIGNER)
                .build())
            .phase(PhaseDefinition.builder("implement")
                .workers(BACKEND_IMPLEMENTER, FRONTEND_IMPLEMENTER)
                .parallel(true)
                .build())
            .phase(PhaseDefinition.builder("review")
                .workers(CODE_REVIEWER, REFACTORING_EXPERT)
                .loopUntil(LoopCondition.parse(UNTIL_NO_CRITICAL), MAX_FIX_ITERATIONS)
                .build())
            .phase(PhaseDefinition.builder("test")
                .workers(TEST_GENERATOR)
                .build())
            .phase(PhaseDefinition.builder("docs")
                .workers(DOCUMENTATION_WRITER)
                .build())
            .build();
    }
}

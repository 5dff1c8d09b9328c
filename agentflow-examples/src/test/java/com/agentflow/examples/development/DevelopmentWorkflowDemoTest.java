package com.agentflow.examples.development;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DevelopmentWorkflowDemoTest {

    @Test
    void run_shouldExitWithRunExitCode() {
        assertThat(DevelopmentWorkflowDemo.run(new String[] {"api-first", "orders and customers"})).isZero();
        assertThat(DevelopmentWorkflowDemo.run(new String[] {"api-first", "dashboard", "--json"})).isEqualTo(1);
        assertThat(DevelopmentWorkflowDemo.run(
            new String[] {"quality-sprint", "legacy hack unsafe duplicate", "--max-iterations=2"})).isEqualTo(2);
    }

    @Test
    void run_shouldRejectBadUsage() {
        assertThat(DevelopmentWorkflowDemo.run(new String[0])).isEqualTo(DevelopmentWorkflowDemo.EXIT_USAGE);
        assertThat(DevelopmentWorkflowDemo.run(new String[] {"quality-sprint", "--focus=style"}))
            .isEqualTo(DevelopmentWorkflowDemo.EXIT_USAGE);
        assertThat(DevelopmentWorkflowDemo.run(new String[] {"quality-sprint", "--max-iterations=0"}))
            .isEqualTo(DevelopmentWorkflowDemo.EXIT_USAGE);
    }

    @Test
    void run_shouldFailForUnknownWorkflow() {
        assertThat(DevelopmentWorkflowDemo.run(new String[] {"release-train"})).isEqualTo(1);
    }
}

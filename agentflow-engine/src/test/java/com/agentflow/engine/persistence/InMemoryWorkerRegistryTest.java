package com.agentflow.engine.persistence;

import com.agentflow.core.exception.DuplicateWorkerException;
import com.agentflow.core.exception.UnknownWorkerException;
import com.agentflow.core.model.WorkerDescriptor;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryWorkerRegistryTest {

    private final InMemoryWorkerRegistry registry = new InMemoryWorkerRegistry();

    @Test
    void register_shouldRejectDuplicateUnlessReplacing() {
        registry.register(worker("code-reviewer", "code-review"));

        assertThatThrownBy(() -> registry.register(worker("code-reviewer", "quality")))
            .isInstanceOf(DuplicateWorkerException.class);

        registry.register(worker("code-reviewer", "quality"), true);
        assertThat(registry.lookup("code-reviewer").capabilities()).containsExactly("quality");
    }

    @Test
    void replace_shouldKeepRegistrationPosition() {
        registry.register(worker("a", "x"));
        registry.register(worker("b", "x"));
        registry.register(worker("a", "x"), true);

        assertThat(registry.findAll()).extracting(WorkerDescriptor::id).containsExactly("a", "b");
        assertThat(registry.findByCapability("x")).extracting(WorkerDescriptor::id).containsExactly("a", "b");
    }

    @Test
    void lookup_shouldFailForUnknownWorker() {
        assertThatThrownBy(() -> registry.lookup("ghost"))
            .isInstanceOf(UnknownWorkerException.class)
            .hasMessageContaining("ghost");
        assertThat(registry.contains("ghost")).isFalse();
    }

    @Test
    void findByCapability_shouldMatchExactTag() {
        registry.register(worker("security-auditor", "security-review"));
        registry.register(worker("code-reviewer", "code-review"));

        assertThat(registry.findByCapability("security-review"))
            .extracting(WorkerDescriptor::id).containsExactly("security-auditor");
        assertThat(registry.findByCapability("security")).isEmpty();
    }

    private static WorkerDescriptor worker(String id, String capability) {
        return WorkerDescriptor.builder().id(id).capabilities(capability).build();
    }
}

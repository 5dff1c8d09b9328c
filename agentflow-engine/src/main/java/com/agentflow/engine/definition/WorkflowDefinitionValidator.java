package com.agentflow.engine.definition;

import com.agentflow.core.exception.WorkflowValidationException;
import com.agentflow.core.model.PhaseDefinition;
import com.agentflow.core.model.WorkflowDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural validation of workflow definitions, applied at registration time.
 * Worker references are resolved later, against the registry, when a run is planned.
 */
@Component
public class WorkflowDefinitionValidator {

    /**
     * Validate a workflow definition.
     *
     * @throws WorkflowValidationException describing the first violation found
     */
    public void validate(WorkflowDefinition definition) {
        if (definition.name() == null || definition.name().isBlank()) {
            throw new WorkflowValidationException("name", "cannot be empty");
        }
        if (definition.phases().isEmpty()) {
            throw new WorkflowValidationException("phases", "cannot be empty");
        }

        Set<String> phaseIds = new HashSet<>();
        for (PhaseDefinition phase : definition.phases()) {
            validatePhase(phase);
            if (!phaseIds.add(phase.phaseId())) {
                throw new WorkflowValidationException("phases", "duplicate phase id: " + phase.phaseId());
            }
        }

        // Validate all dependency targets exist
        for (PhaseDefinition phase : definition.phases()) {
            if (!phase.hasExplicitDependencies()) {
                continue;
            }
            for (String target : phase.dependsOn()) {
                if (target.equals(phase.phaseId())) {
                    throw new WorkflowValidationException("dependsOn",
                        "phase " + phase.phaseId() + " depends on itself; use loopUntil for re-entry");
                }
                if (!phaseIds.contains(target)) {
                    throw new WorkflowValidationException("dependsOn",
                        "phase " + phase.phaseId() + " references non-existent phase: " + target);
                }
            }
        }

        List<String> unordered = findCycle(definition);
        if (!unordered.isEmpty()) {
            throw new WorkflowValidationException("dependsOn", "dependency cycle among phases " + unordered);
        }
    }

    private void validatePhase(PhaseDefinition phase) {
        if (phase.phaseId() == null || phase.phaseId().isBlank()) {
            throw new WorkflowValidationException("phaseId", "cannot be empty");
        }
        if (phase.workers().isEmpty()) {
            throw new WorkflowValidationException("workers", "phase " + phase.phaseId() + " has no workers");
        }
        for (String reference : phase.workers()) {
            if (reference == null || reference.isBlank()) {
                throw new WorkflowValidationException("workers",
                    "phase " + phase.phaseId() + " has an empty worker reference");
            }
            if (PhaseDefinition.isCapabilityReference(reference)
                    && PhaseDefinition.capabilityOf(reference).isBlank()) {
                throw new WorkflowValidationException("workers",
                    "phase " + phase.phaseId() + " has a capability reference without a tag");
            }
        }
        if (phase.maxIterations() < 1) {
            throw new WorkflowValidationException("maxIterations",
                "phase " + phase.phaseId() + " must allow at least one iteration, was " + phase.maxIterations());
        }
    }

    /**
     * Kahn's algorithm over the resolved dependency edges.
     *
     * @return Phases left unordered (members of or downstream of a cycle); empty for a DAG
     */
    private List<String> findCycle(WorkflowDefinition definition) {
        Map<String, Integer> inDegree = new HashMap<>();
        for (String phaseId : definition.phaseIds()) {
            inDegree.put(phaseId, new HashSet<>(definition.dependenciesOf(phaseId)).size());
        }

        Deque<String> ready = new ArrayDeque<>();
        for (String phaseId : definition.phaseIds()) {
            if (inDegree.get(phaseId) == 0) {
                ready.add(phaseId);
            }
        }

        Set<String> ordered = new HashSet<>();
        while (!ready.isEmpty()) {
            String phaseId = ready.poll();
            ordered.add(phaseId);
            for (String successor : definition.successorsOf(phaseId)) {
                if (inDegree.merge(successor, -1, Integer::sum) == 0) {
                    ready.add(successor);
                }
            }
        }

        List<String> unordered = new ArrayList<>();
        for (String phaseId : definition.phaseIds()) {
            if (!ordered.contains(phaseId)) {
                unordered.add(phaseId);
            }
        }
        return unordered;
    }
}

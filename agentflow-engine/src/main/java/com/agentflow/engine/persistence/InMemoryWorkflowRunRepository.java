package com.agentflow.engine.persistence;

import com.agentflow.core.model.RunStatus;
import com.agentflow.core.model.WorkflowRun;
import com.agentflow.core.repository.WorkflowRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of WorkflowRunRepository.
 * Holds active runs and a bounded archive of terminal ones.
 */
@Repository
public class InMemoryWorkflowRunRepository implements WorkflowRunRepository {
    
    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkflowRunRepository.class);
    
    private static final Comparator<WorkflowRun> NEWEST_FIRST =
        Comparator.comparing(WorkflowRun::createdAt).reversed();
    
    private final Map<String, WorkflowRun> runs = new ConcurrentHashMap<>();
    
    @Override
    public void save(WorkflowRun run) {
        runs.merge(run.runId(), run,
            (existing, candidate) -> candidate.sequenceNumber() >= existing.sequenceNumber() ? candidate : existing);
    }
    
    @Override
    public Optional<WorkflowRun> findById(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }
    
    @Override
    public List<WorkflowRun> findByStatus(RunStatus status, int limit) {
        return runs.values().stream()
            .filter(r -> r.status() == status)
            .sorted(NEWEST_FIRST)
            .limit(limit)
            .toList();
    }
    
    @Override
    public List<WorkflowRun> findByWorkflow(String workflowName, int limit) {
        return runs.values().stream()
            .filter(r -> r.workflowName().equals(workflowName))
            .sorted(NEWEST_FIRST)
            .limit(limit)
            .toList();
    }
    
    @Override
    public long countActive() {
        return runs.values().stream().filter(r -> !r.isTerminal()).count();
    }
    
    @Override
    public int evictTerminal(int retain) {
        List<WorkflowRun> terminal = runs.values().stream()
            .filter(WorkflowRun::isTerminal)
            .sorted(Comparator.comparing(
                (WorkflowRun r) -> r.completedAt() != null ? r.completedAt() : Instant.EPOCH).reversed())
            .toList();
        int evicted = 0;
        for (int i = Math.max(0, retain); i < terminal.size(); i++) {
            if (runs.remove(terminal.get(i).runId()) != null) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} archived runs, retaining {}", evicted, retain);
        }
        return evicted;
    }
}

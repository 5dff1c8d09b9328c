package com.agentflow.engine.persistence;

import com.agentflow.core.model.WorkflowDefinition;
import com.agentflow.core.repository.WorkflowDefinitionRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of WorkflowDefinitionRepository.
 */
@Repository
public class InMemoryWorkflowDefinitionRepository implements WorkflowDefinitionRepository {
    
    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();
    
    @Override
    public void save(WorkflowDefinition definition) {
        definitions.put(definition.name(), definition);
    }
    
    @Override
    public Optional<WorkflowDefinition> findByName(String name) {
        return Optional.ofNullable(definitions.get(name));
    }
    
    @Override
    public List<WorkflowDefinition> findAll() {
        return definitions.values().stream()
            .sorted(Comparator.comparing(WorkflowDefinition::name))
            .toList();
    }
    
    @Override
    public boolean exists(String name) {
        return definitions.containsKey(name);
    }
}

package com.agentflow.api.rest;

import com.agentflow.core.model.FieldSpec;
import com.agentflow.core.model.TriggerMode;
import com.agentflow.core.model.TriggerPredicate;
import com.agentflow.core.model.WorkerDescriptor;
import com.agentflow.core.repository.WorkerRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * REST API for the worker registry.
 */
@RestController
@RequestMapping("/api/v1/workers")
public class WorkerController {

    private final WorkerRegistry workerRegistry;

    public WorkerController(WorkerRegistry workerRegistry) {
        this.workerRegistry = workerRegistry;
    }

    /**
     * List workers in registration order, optionally only those with a capability.
     */
    @GetMapping
    public ResponseEntity<List<WorkerResponse>> listWorkers(
            @RequestParam(required = false) String capability) {

        List<WorkerDescriptor> workers = capability != null
            ? workerRegistry.findByCapability(capability)
            : workerRegistry.findAll();
        return ResponseEntity.ok(workers.stream().map(WorkerResponse::from).toList());
    }

    /**
     * Get a worker by id.
     */
    @GetMapping("/{workerId}")
    public ResponseEntity<WorkerResponse> getWorker(@PathVariable String workerId) {
        return ResponseEntity.ok(WorkerResponse.from(workerRegistry.lookup(workerId)));
    }

    // ========== DTOs ==========

    public record TriggerResponse(
        String event,
        String field,
        String pattern,
        TriggerMode mode
    ) {
        public static TriggerResponse from(TriggerPredicate predicate) {
            return new TriggerResponse(
                predicate.eventKind().name(),
                predicate.field(),
                predicate.pattern().pattern(),
                predicate.mode()
            );
        }
    }

    public record WorkerResponse(
        String id,
        String description,
        Set<String> capabilities,
        List<TriggerResponse> triggers,
        List<FieldSpec> inputs,
        List<String> outputs,
        boolean critical,
        Duration timeout,
        URI endpoint
    ) {
        public static WorkerResponse from(WorkerDescriptor descriptor) {
            return new WorkerResponse(
                descriptor.id(),
                descriptor.description(),
                descriptor.capabilities(),
                descriptor.triggerPredicates().stream().map(TriggerResponse::from).toList(),
                descriptor.inputContract(),
                descriptor.outputContract(),
                descriptor.critical(),
                descriptor.timeout(),
                descriptor.endpoint()
            );
        }
    }
}

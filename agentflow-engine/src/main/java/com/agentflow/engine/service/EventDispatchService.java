package com.agentflow.engine.service;

import com.agentflow.core.model.Event;
import com.agentflow.core.model.FinalResult;
import com.agentflow.core.model.PhaseDefinition;
import com.agentflow.core.model.RunOptions;
import com.agentflow.core.model.TriggerMatch;
import com.agentflow.core.model.WorkflowDefinition;
import com.agentflow.core.repository.WorkerRegistry;
import com.agentflow.engine.metrics.WorkflowMetrics;
import com.agentflow.engine.trigger.TriggerEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns observed events into work.
 * Automatic matches run at once as a single parallel phase; matches that need
 * confirmation are handed back as proposals.
 */
public class EventDispatchService {

    private static final Logger log = LoggerFactory.getLogger(EventDispatchService.class);

    public static final String TRIGGERED_PREFIX = "triggered-";
    public static final String DISPATCH_PHASE = "dispatch";

    private final TriggerEvaluator triggerEvaluator;
    private final WorkerRegistry workerRegistry;
    private final WorkflowService workflowService;
    private final WorkflowMetrics metrics;

    public EventDispatchService(
            TriggerEvaluator triggerEvaluator,
            WorkerRegistry workerRegistry,
            WorkflowService workflowService,
            WorkflowMetrics metrics) {
        this.triggerEvaluator = triggerEvaluator;
        this.workerRegistry = workerRegistry;
        this.workflowService = workflowService;
        this.metrics = metrics;
    }

    /**
     * Result of dispatching one event.
     *
     * @param dispatched Matches that ran
     * @param proposed   Matches awaiting confirmation
     * @param result     Result of the triggered run; null when nothing ran
     */
    public record DispatchResult(
        String eventId,
        String eventKind,
        List<TriggerMatch> dispatched,
        List<TriggerMatch> proposed,
        FinalResult result
    ) {
        public DispatchResult {
            dispatched = List.copyOf(dispatched);
            proposed = List.copyOf(proposed);
        }
    }

    /**
     * Evaluate an event and run the workers it selects automatically.
     *
     * @throws com.agentflow.core.exception.UnknownWorkerException if an explicit command names an unknown worker
     */
    public DispatchResult dispatch(Event event, RunOptions options) {
        List<TriggerMatch> matches = triggerEvaluator.evaluateMatches(event, workerRegistry);
        List<TriggerMatch> automatic = matches.stream().filter(TriggerMatch::isAutomatic).toList();
        List<TriggerMatch> proposed = matches.stream().filter(m -> !m.isAutomatic()).toList();
        metrics.eventDispatched(event.kind().name(), automatic.size(), proposed.size());

        if (!proposed.isEmpty()) {
            log.info("Event {} proposes workers {} for confirmation", event.eventId(),
                proposed.stream().map(TriggerMatch::workerId).toList());
        }
        if (automatic.isEmpty()) {
            log.info("Event {} ({}) triggered no workers", event.eventId(), event.kind());
            return new DispatchResult(event.eventId().toString(), event.kind().name(), List.of(), proposed, null);
        }

        WorkflowDefinition definition = triggeredWorkflow(event, automatic);
        log.info("Event {} triggers {}", event.eventId(), definition.getPhase(DISPATCH_PHASE).workers());
        FinalResult result = workflowService.runWorkflow(definition, argumentOf(event),
            options != null ? options : RunOptions.defaults());
        return new DispatchResult(event.eventId().toString(), event.kind().name(), automatic, proposed, result);
    }

    /**
     * Ad hoc workflow with one parallel phase holding the matched workers.
     */
    WorkflowDefinition triggeredWorkflow(Event event, List<TriggerMatch> matches) {
        String kind = event.kind().name().toLowerCase(Locale.ROOT).replace('_', '-');
        return WorkflowDefinition.builder()
            .name(TRIGGERED_PREFIX + kind)
            .description("Workers triggered by event " + event.eventId())
            .labels(Map.of("eventId", event.eventId().toString(), "source", String.valueOf(event.source())))
            .phase(PhaseDefinition.builder(DISPATCH_PHASE)
                .workers(matches.stream().map(TriggerMatch::workerId).toList())
                .parallel(true)
                .build())
            .build();
    }

    private static String argumentOf(Event event) {
        for (String field : List.of(Event.FIELD_ARGUMENT, Event.FIELD_PATH, Event.FIELD_MESSAGE)) {
            String value = event.payloadField(field);
            if (value != null) {
                return value;
            }
        }
        return event.payloadText();
    }
}

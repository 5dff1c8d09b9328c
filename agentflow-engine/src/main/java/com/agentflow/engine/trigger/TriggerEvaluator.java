package com.agentflow.engine.trigger;

import com.agentflow.core.exception.UnknownWorkerException;
import com.agentflow.core.model.Event;
import com.agentflow.core.model.EventKind;
import com.agentflow.core.model.TriggerMatch;
import com.agentflow.core.model.TriggerMode;
import com.agentflow.core.model.TriggerPredicate;
import com.agentflow.core.model.WorkerDescriptor;
import com.agentflow.core.repository.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which workers an event selects.
 *
 * Workers are evaluated in registration order and independently of each other, so several
 * workers may match the same event. A worker is selected at most once per event; its first
 * matching predicate decides the trigger mode. Explicit commands bypass predicates.
 */
@Component
public class TriggerEvaluator {

    private static final Logger log = LoggerFactory.getLogger(TriggerEvaluator.class);

    static final String EXPLICIT_COMMAND = "explicit command";

    /**
     * Ids of the workers selected by the event, in registration order.
     *
     * @return Matching worker ids; empty if nothing matches
     * @throws UnknownWorkerException if an explicit command names an unregistered worker
     */
    public List<String> evaluate(Event event, WorkerRegistry registry) {
        return evaluateMatches(event, registry).stream().map(TriggerMatch::workerId).toList();
    }

    /**
     * Selected workers with the mode they fire in.
     *
     * @throws UnknownWorkerException if an explicit command names an unregistered worker
     */
    public List<TriggerMatch> evaluateMatches(Event event, WorkerRegistry registry) {
        if (event.kind() == EventKind.EXPLICIT_COMMAND) {
            return List.of(resolveCommand(event, registry));
        }

        List<TriggerMatch> matches = new ArrayList<>();
        for (WorkerDescriptor worker : registry.findAll()) {
            for (TriggerPredicate predicate : worker.triggerPredicates()) {
                if (predicate.matches(event)) {
                    matches.add(new TriggerMatch(worker.id(), predicate.mode(), predicate.describe()));
                    break;
                }
            }
        }
        log.debug("Event {} ({}) matched {} workers", event.eventId(), event.kind(), matches.size());
        return matches;
    }

    private TriggerMatch resolveCommand(Event event, WorkerRegistry registry) {
        String workerId = event.payloadField(Event.FIELD_WORKER_ID);
        if (workerId == null || workerId.isBlank()) {
            throw new UnknownWorkerException("<none>", "explicit command names no worker");
        }
        WorkerDescriptor worker = registry.lookup(workerId);
        return new TriggerMatch(worker.id(), TriggerMode.AUTOMATIC, EXPLICIT_COMMAND);
    }
}

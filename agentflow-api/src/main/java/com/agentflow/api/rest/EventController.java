package com.agentflow.api.rest;

import com.agentflow.core.model.Event;
import com.agentflow.core.model.EventKind;
import com.agentflow.core.model.Focus;
import com.agentflow.core.model.RunOptions;
import com.agentflow.core.model.TriggerMatch;
import com.agentflow.engine.report.RunReportRenderer;
import com.agentflow.engine.service.EventDispatchService;
import com.agentflow.engine.service.EventDispatchService.DispatchResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for observed events.
 * Workers selected automatically run at once; workers that need confirmation are returned
 * as proposals and can be started with an EXPLICIT_COMMAND event.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventDispatchService dispatchService;
    private final RunReportRenderer reportRenderer;

    public EventController(EventDispatchService dispatchService, RunReportRenderer reportRenderer) {
        this.dispatchService = dispatchService;
        this.reportRenderer = reportRenderer;
    }

    /**
     * Evaluate an event against the registered trigger predicates.
     */
    @PostMapping
    public ResponseEntity<DispatchResponse> dispatch(@RequestBody EventRequest request) {
        if (request.kind() == null) {
            throw new IllegalArgumentException("Event kind is required");
        }
        Event event = Event.of(request.kind(), request.payload(),
            request.source() != null ? request.source() : Event.SOURCE_EXTERNAL);

        DispatchResult result = dispatchService.dispatch(event, RunOptions.defaults().withFocus(request.focus()));
        return ResponseEntity.ok(DispatchResponse.from(result, reportRenderer));
    }

    // ========== DTOs ==========

    public record EventRequest(
        EventKind kind,
        JsonNode payload,
        String source,
        Focus focus
    ) {}

    public record DispatchResponse(
        String eventId,
        String eventKind,
        List<TriggerMatch> dispatched,
        List<TriggerMatch> proposed,
        ObjectNode report
    ) {
        public static DispatchResponse from(DispatchResult result, RunReportRenderer renderer) {
            return new DispatchResponse(
                result.eventId(),
                result.eventKind(),
                result.dispatched(),
                result.proposed(),
                result.result() != null ? renderer.toJson(result.result()) : null
            );
        }
    }
}

package com.agentflow.worker.invoker;

import com.agentflow.core.exception.WorkerInvocationException;
import com.agentflow.core.exception.WorkerTimeoutException;
import com.agentflow.core.model.WorkerDescriptor;
import com.agentflow.core.model.WorkerOutcome;
import com.agentflow.worker.WorkerContext;
import com.agentflow.worker.WorkerException;
import com.agentflow.worker.WorkerResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Invokes remote capabilities over HTTP.
 *
 * Request: POST to the descriptor's endpoint with
 * {@code {runId, workflow, phaseId, iteration, workerId, argument, context, inputs}}.
 * Reply: a {@link WorkerResult} document {@code {status, producedFields, diagnostics}}.
 */
public class HttpWorkerInvoker implements WorkerInvoker {

    private static final Logger log = LoggerFactory.getLogger(HttpWorkerInvoker.class);

    public static final String ERROR_HTTP_STATUS = "HTTP_ERROR";
    public static final String ERROR_BAD_REPLY = "BAD_REPLY";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpWorkerInvoker(ObjectMapper objectMapper, Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), objectMapper, requestTimeout);
    }

    public HttpWorkerInvoker(HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public boolean supports(WorkerDescriptor descriptor) {
        return descriptor.isRemote();
    }

    @Override
    public WorkerResult invoke(WorkerDescriptor descriptor, WorkerContext context) throws WorkerException {
        if (!descriptor.isRemote()) {
            throw new WorkerInvocationException(descriptor.id(), "No endpoint configured");
        }
        String body = requestBody(context);
        Duration timeout = descriptor.timeout() != null ? descriptor.timeout() : requestTimeout;

        HttpRequest request = HttpRequest.newBuilder()
            .uri(descriptor.endpoint())
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();

        HttpResponse<String> response;
        try {
            log.debug("POST {} for worker {}", descriptor.endpoint(), descriptor.id());
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new WorkerException(WorkerTimeoutException.ERROR_CODE,
                String.format("Worker %s did not answer within %s", descriptor.id(), timeout), e);
        } catch (IOException e) {
            throw new WorkerInvocationException(descriptor.id(),
                "Cannot reach endpoint " + descriptor.endpoint() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerException(WorkerOutcome.ERROR_CANCELLED, "Invocation of " + descriptor.id() + " interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            log.warn("Worker {} answered with status {}", descriptor.id(), response.statusCode());
            throw new WorkerException(ERROR_HTTP_STATUS,
                String.format("Worker %s answered HTTP %d: %s", descriptor.id(), response.statusCode(), response.body()));
        }

        try {
            return objectMapper.readValue(response.body(), WorkerResult.class);
        } catch (JsonProcessingException e) {
            throw new WorkerException(ERROR_BAD_REPLY,
                "Worker " + descriptor.id() + " sent an unreadable reply: " + e.getOriginalMessage(), e);
        }
    }

    private String requestBody(WorkerContext context) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("runId", context.getRunId());
        body.put("workflow", context.getWorkflowName());
        body.put("phaseId", context.getPhaseId());
        body.put("iteration", context.getIteration());
        body.put("workerId", context.getWorkerId());
        body.put("argument", context.getArgument());
        ObjectNode snapshot = body.putObject("context");
        context.getSnapshot().asMap().forEach(snapshot::set);
        ObjectNode inputs = body.putObject("inputs");
        context.getInputs().forEach(inputs::set);
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new WorkerInvocationException(context.getWorkerId(), "Cannot encode request", e);
        }
    }
}

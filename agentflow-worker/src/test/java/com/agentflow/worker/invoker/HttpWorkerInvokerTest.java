package com.agentflow.worker.invoker;

import com.agentflow.core.context.ContextSnapshot;
import com.agentflow.core.exception.WorkerInvocationException;
import com.agentflow.core.model.OutcomeStatus;
import com.agentflow.core.model.Severity;
import com.agentflow.core.model.WorkerDescriptor;
import com.agentflow.worker.WorkerContext;
import com.agentflow.worker.WorkerException;
import com.agentflow.worker.WorkerResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpWorkerInvokerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<JsonNode> lastRequest = new AtomicReference<>();
    private HttpServer server;
    private HttpWorkerInvoker invoker;

    @BeforeEach
    void startStubWorker() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/review", exchange -> {
            lastRequest.set(objectMapper.readTree(exchange.getRequestBody()));
            respond(exchange, 200, """
                {"status":"SUCCESS",
                 "producedFields":{"findings":"2 issues"},
                 "diagnostics":{"counts":{"criticalCount":1},
                                "entries":[{"severity":"HIGH","code":"SEC-7","message":"weak hash","source":null}]}}
                """);
        });
        server.createContext("/broken", exchange -> respond(exchange, 500, "boom"));
        server.createContext("/garbage", exchange -> respond(exchange, 200, "not json"));
        server.start();
        invoker = new HttpWorkerInvoker(objectMapper, Duration.ofSeconds(5));
    }

    @AfterEach
    void stopStubWorker() {
        server.stop(0);
    }

    private static void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private WorkerDescriptor remote(String path) {
        return WorkerDescriptor.builder()
            .id("security-auditor")
            .endpoint(URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path))
            .build();
    }

    private WorkerContext context(WorkerDescriptor descriptor) {
        ContextSnapshot snapshot = new ContextSnapshot(Map.of("design", TextNode.valueOf("rest")));
        return new WorkerContext("run-7", "api-first", "review", 2, descriptor, "payments",
            snapshot, Map.of("design", TextNode.valueOf("rest")), objectMapper, () -> false);
    }

    @Test
    void invoke_shouldPostContextAndMapReply() throws Exception {
        WorkerDescriptor descriptor = remote("/review");

        WorkerResult result = invoker.invoke(descriptor, context(descriptor));

        assertThat(result.status()).isEqualTo(OutcomeStatus.SUCCESS);
        assertThat(result.producedFields().get("findings").asText()).isEqualTo("2 issues");
        assertThat(result.diagnostics().count("criticalCount")).isEqualTo(1);
        assertThat(result.diagnostics().entries()).singleElement()
            .satisfies(e -> assertThat(e.severity()).isEqualTo(Severity.HIGH));

        JsonNode request = lastRequest.get();
        assertThat(request.get("runId").asText()).isEqualTo("run-7");
        assertThat(request.get("iteration").asInt()).isEqualTo(2);
        assertThat(request.get("workerId").asText()).isEqualTo("security-auditor");
        assertThat(request.at("/context/design").asText()).isEqualTo("rest");
        assertThat(request.at("/inputs/design").asText()).isEqualTo("rest");
    }

    @Test
    void invoke_shouldTurnErrorStatusIntoWorkerException() {
        WorkerDescriptor descriptor = remote("/broken");

        assertThatThrownBy(() -> invoker.invoke(descriptor, context(descriptor)))
            .isInstanceOf(WorkerException.class)
            .extracting(e -> ((WorkerException) e).getErrorCode())
            .isEqualTo(HttpWorkerInvoker.ERROR_HTTP_STATUS);
    }

    @Test
    void invoke_shouldRejectUnreadableReply() {
        WorkerDescriptor descriptor = remote("/garbage");

        assertThatThrownBy(() -> invoker.invoke(descriptor, context(descriptor)))
            .isInstanceOf(WorkerException.class)
            .extracting(e -> ((WorkerException) e).getErrorCode())
            .isEqualTo(HttpWorkerInvoker.ERROR_BAD_REPLY);
    }

    @Test
    void invoke_shouldFailWhenEndpointUnreachable() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        WorkerDescriptor descriptor = WorkerDescriptor.builder()
            .id("security-auditor")
            .endpoint(URI.create("http://127.0.0.1:" + closedPort + "/review"))
            .build();

        assertThatThrownBy(() -> invoker.invoke(descriptor, context(descriptor)))
            .isInstanceOf(WorkerInvocationException.class);
    }

    @Test
    void supports_shouldOnlyAcceptRemoteDescriptors() {
        assertThat(invoker.supports(remote("/review"))).isTrue();
        assertThat(invoker.supports(WorkerDescriptor.builder().id("local").build())).isFalse();
    }
}

package io.kitchensync.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.kitchensync.core.daemon.DaemonStatus;
import io.kitchensync.core.job.JobRun;
import io.kitchensync.core.run.CancelOutcome;
import io.kitchensync.core.run.RunHistoryService;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-mostly HTTP surface over run history: health, run listing, log text and cancellation.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final RunHistoryService history;
    private final DaemonStatus daemonStatus;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public GatewayServer(int port, String host, RunHistoryService history, DaemonStatus daemonStatus) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.daemonStatus = daemonStatus == null ? DaemonStatus.stopped() : daemonStatus;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        RoutingHandler routes = Handlers.routing()
            .get("/healthz", this::handleHealth)
            .get("/jobs/{jobId}/runs", blocking(this::handleListRuns))
            .get("/jobs/{jobId}/runs/{runId}/log", blocking(this::handleReadLog))
            .post("/jobs/{jobId}/runs/{runId}/cancel", blocking(this::handleCancel))
            .setFallbackHandler(exchange -> sendJson(exchange, 404, Map.of("error", "not_found")))
            .setInvalidMethodHandler(exchange -> sendJson(exchange, 405, Map.of("error", "method_not_allowed")));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Gateway listening on http://{}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", "ok");
        payload.put("scheduler", Map.of("running", daemonStatus.isSchedulerRunning()));
        payload.put("executor", Map.of("running", daemonStatus.isExecutorRunning()));
        sendJson(exchange, 200, payload);
    }

    private void handleListRuns(HttpServerExchange exchange) throws IOException {
        String jobId = pathParam(exchange, "jobId");
        Optional<List<JobRun>> runs = history.listRuns(jobId);
        if (runs.isEmpty()) {
            sendJson(exchange, 404, Map.of("error", "job_not_found"));
            return;
        }
        sendJson(exchange, 200, Map.of("jobId", jobId, "runs", runs.get()));
    }

    private void handleReadLog(HttpServerExchange exchange) throws IOException {
        String jobId = pathParam(exchange, "jobId");
        String runId = pathParam(exchange, "runId");
        Optional<String> log = history.readLog(jobId, runId);
        if (log.isEmpty()) {
            sendJson(exchange, 404, Map.of("error", "run_not_found"));
            return;
        }
        byte[] body = log.get().getBytes(StandardCharsets.UTF_8);
        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void handleCancel(HttpServerExchange exchange) throws IOException {
        String jobId = pathParam(exchange, "jobId");
        String runId = pathParam(exchange, "runId");
        CancelOutcome outcome = history.cancel(jobId, runId);
        int status = switch (outcome) {
            case CANCELLED, SIGNALLED -> 202;
            case NOT_FOUND -> 404;
            case ALREADY_FINISHED, NOT_RUNNING_HERE -> 409;
        };
        sendJson(exchange, status, Map.of("runId", runId, "outcome", outcome.name()));
    }

    private HttpHandler blocking(ExchangeHandler handler) {
        return exchange -> {
            if (exchange.isInIoThread()) {
                exchange.dispatch(() -> invoke(handler, exchange));
                return;
            }
            invoke(handler, exchange);
        };
    }

    private void invoke(ExchangeHandler handler, HttpServerExchange exchange) {
        try {
            handler.handle(exchange);
        } catch (Exception e) {
            LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            sendInternalError(exchange, e);
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        if (exchange.isResponseStarted()) {
            return;
        }
        try {
            sendJson(exchange, 500, Map.of("error", error.getMessage() == null ? "internal_error" : error.getMessage()));
        } catch (IOException e) {
            LOG.debug("Failed to send error response: {}", e.getMessage());
        }
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Missing path parameter " + name);
        }
        return values.getFirst();
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        try {
            Object address = undertow.getListenerInfo().get(0).getAddress();
            if (address instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        } catch (RuntimeException e) {
            LOG.debug("Could not resolve bound port: {}", e.getMessage());
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface ExchangeHandler {
        void handle(HttpServerExchange exchange) throws Exception;
    }
}

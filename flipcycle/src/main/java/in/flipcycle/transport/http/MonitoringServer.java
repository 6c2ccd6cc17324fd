package in.flipcycle.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.flipcycle.application.service.LifecycleController;
import in.flipcycle.domain.cycle.CycleSnapshot;
import in.flipcycle.domain.cycle.FlipCycle;
import in.flipcycle.service.vault.VaultLedger;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * HTTP monitoring surface.
 *
 * Endpoints:
 * - GET  /metrics                      Prometheus text format
 * - GET  /health                       capital, vault and cycle counts
 * - GET  /cycles                       snapshots of every cycle
 * - GET  /cycles/{cycleId}             one snapshot
 * - POST /cycles/{cycleId}/resolve?exitPrice=...   complete a flagged cycle
 */
public final class MonitoringServer {
    private static final Logger log = LoggerFactory.getLogger(MonitoringServer.class);

    private final int port;
    private final LifecycleController controller;
    private final CollectorRegistry registry;
    private final ObjectMapper mapper;
    private Undertow server;

    public MonitoringServer(int port, LifecycleController controller, CollectorRegistry registry, ObjectMapper mapper) {
        this.port = port;
        this.controller = controller;
        this.registry = registry;
        this.mapper = mapper;
    }

    public synchronized void start() {
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", this::metrics)
            .get("/health", this::health)
            .get("/cycles", this::cycles)
            .get("/cycles/{cycleId}", this::cycle)
            .post("/cycles/{cycleId}/resolve", this::resolve)
            .setFallbackHandler(exchange -> sendError(exchange, StatusCodes.NOT_FOUND, "Not found"));

        server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(new BlockingHandler(routes))
            .build();
        server.start();
        log.info("✓ Monitoring server started on port {}", boundPort());
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop();
            server = null;
            log.info("Monitoring server stopped");
        }
    }

    /**
     * Actual listening port; differs from the configured one when that was 0.
     */
    public synchronized int boundPort() {
        if (server == null) {
            return port;
        }
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    // GET /metrics
    void metrics(HttpServerExchange exchange) throws IOException {
        StringWriter writer = new StringWriter();
        TextFormat.write004(writer, registry.metricFamilySamples());
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
        exchange.getResponseSender().send(writer.toString(), StandardCharsets.UTF_8);
    }

    // GET /health
    void health(HttpServerExchange exchange) throws IOException {
        List<FlipCycle> all = controller.cycles();
        VaultLedger ledger = controller.vaultLedger();

        ObjectNode body = mapper.createObjectNode();
        body.put("status", "UP");
        body.put("activeCycles", controller.activeCycleCount());
        body.put("totalCycles", all.size());
        body.put("manualIntervention", all.stream().filter(FlipCycle::manualIntervention).count());
        ObjectNode capital = body.putObject("capital");
        capital.put("available", controller.capitalPool().available());
        capital.put("reserved", controller.capitalPool().reserved());
        ObjectNode vault = body.putObject("vault");
        vault.put("pendingReserve", ledger.pendingReserve());
        vault.put("transferredReserve", ledger.transferredReserve());
        vault.put("entries", ledger.entries().size());
        sendJson(exchange, body);
    }

    // GET /cycles
    void cycles(HttpServerExchange exchange) throws IOException {
        List<CycleSnapshot> snapshots = controller.cycles().stream().map(FlipCycle::snapshot).toList();
        sendJson(exchange, snapshots);
    }

    // GET /cycles/{cycleId}
    void cycle(HttpServerExchange exchange) throws IOException {
        String cycleId = pathParam(exchange, "cycleId");
        Optional<FlipCycle> cycle = controller.cycle(cycleId);
        if (cycle.isEmpty()) {
            sendError(exchange, StatusCodes.NOT_FOUND, "Unknown cycle: " + cycleId);
            return;
        }
        sendJson(exchange, cycle.get().snapshot());
    }

    // POST /cycles/{cycleId}/resolve?exitPrice=
    void resolve(HttpServerExchange exchange) throws IOException {
        String cycleId = pathParam(exchange, "cycleId");
        Deque<String> priceParam = exchange.getQueryParameters().get("exitPrice");
        if (priceParam == null || priceParam.isEmpty()) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "exitPrice is required");
            return;
        }
        BigDecimal exitPrice;
        try {
            exitPrice = new BigDecimal(priceParam.getFirst());
        } catch (NumberFormatException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid exitPrice: " + priceParam.getFirst());
            return;
        }

        try {
            FlipCycle cycle = controller.resolveManualIntervention(cycleId, exitPrice);
            log.info("Cycle {} resolved over HTTP @ {}", cycleId, exitPrice);
            sendJson(exchange, cycle.snapshot());
        } catch (IllegalArgumentException e) {
            sendError(exchange, StatusCodes.NOT_FOUND, e.getMessage());
        } catch (IllegalStateException e) {
            sendError(exchange, StatusCodes.CONFLICT, e.getMessage());
        }
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        return match != null ? match.getParameters().get(name) : null;
    }

    private void sendJson(HttpServerExchange exchange, Object data) throws IOException {
        String json = mapper.writeValueAsString(data);
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private static void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}

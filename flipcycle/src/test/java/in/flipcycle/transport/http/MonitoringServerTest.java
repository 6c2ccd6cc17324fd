package in.flipcycle.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.flipcycle.application.port.output.AlertNotifier;
import in.flipcycle.application.service.LifecycleController;
import in.flipcycle.domain.cycle.SubmissionResult;
import in.flipcycle.domain.signal.ScoreBreakdown;
import in.flipcycle.domain.signal.ScoringWeights;
import in.flipcycle.infrastructure.metrics.PrometheusCycleMetrics;
import in.flipcycle.infrastructure.paper.PaperExchange;
import in.flipcycle.infrastructure.persistence.InMemoryCycleSnapshotRepository;
import in.flipcycle.infrastructure.persistence.JsonMappers;
import in.flipcycle.service.history.InMemoryHistoryStore;
import in.flipcycle.support.MutableClock;
import in.flipcycle.support.TestSignals;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * HTTP tests for MonitoringServer on an ephemeral port.
 *
 * Tests:
 * - /health and /cycles views
 * - 404 for unknown cycles and paths
 * - /resolve argument and state errors
 * - /metrics exposition
 */
class MonitoringServerTest {

    private final HttpClient client = HttpClient.newHttpClient();
    private final ObjectMapper mapper = JsonMappers.create();

    private ScheduledExecutorService scheduler;
    private LifecycleController controller;
    private MonitoringServer server;
    private String cycleId;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(TestSignals.T0);
        PaperExchange paper = new PaperExchange(clock);
        paper.setPrice("BTC/USDT", new BigDecimal("100"));
        CollectorRegistry registry = new CollectorRegistry();
        scheduler = Executors.newSingleThreadScheduledExecutor();

        controller = LifecycleController.builder()
            .priceFeed(paper)
            .exchange(paper)
            .alerts(mock(AlertNotifier.class))
            .snapshots(new InMemoryCycleSnapshotRepository())
            .history(new InMemoryHistoryStore())
            .reserveTransfer((amount, reference) -> true)
            .scheduler(scheduler)
            .scoringStrategy((signal, context) -> ScoreBreakdown.uniform(80, ScoringWeights.defaults()))
            .metrics(new PrometheusCycleMetrics(registry))
            .clock(clock)
            .build();

        SubmissionResult result = controller.submit(TestSignals.btc().build());
        assertTrue(result.isAdmitted());
        cycleId = result.cycleId();

        server = new MonitoringServer(0, controller, registry, mapper);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        controller.shutdown();
        scheduler.shutdownNow();
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).POST(HttpRequest.BodyPublishers.noBody()).build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.boundPort() + path);
    }

    @Test
    void testHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        JsonNode body = mapper.readTree(response.body());
        assertEquals("UP", body.get("status").asText());
        assertEquals(1, body.get("activeCycles").asInt());
        assertEquals(0, new BigDecimal("500").compareTo(body.get("capital").get("reserved").decimalValue()));
        assertEquals(0, body.get("vault").get("entries").asInt());
    }

    @Test
    void testCycles() throws Exception {
        HttpResponse<String> all = get("/cycles");
        HttpResponse<String> one = get("/cycles/" + cycleId);

        assertEquals(200, all.statusCode());
        JsonNode list = mapper.readTree(all.body());
        assertEquals(1, list.size());
        assertEquals(cycleId, list.get(0).get("cycleId").asText());

        assertEquals(200, one.statusCode());
        JsonNode snapshot = mapper.readTree(one.body());
        assertEquals("LADDER_DEPLOYED", snapshot.get("phase").asText());
        assertEquals(3, snapshot.get("rungs").size());
    }

    @Test
    void testUnknownCycleAndPath() throws Exception {
        assertEquals(404, get("/cycles/CYC-missing").statusCode());
        assertEquals(404, get("/nothing-here").statusCode());
    }

    @Test
    void testResolveErrors() throws Exception {
        assertEquals(400, post("/cycles/" + cycleId + "/resolve").statusCode(), "exitPrice missing");
        assertEquals(400, post("/cycles/" + cycleId + "/resolve?exitPrice=abc").statusCode());
        assertEquals(404, post("/cycles/CYC-missing/resolve?exitPrice=100").statusCode());

        HttpResponse<String> notFlagged = post("/cycles/" + cycleId + "/resolve?exitPrice=100");
        assertEquals(409, notFlagged.statusCode());
        assertTrue(notFlagged.body().contains("not awaiting manual intervention"));
    }

    @Test
    void testMetrics() throws Exception {
        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("flip_submissions_total"));
        assertTrue(response.body().contains("flip_active_cycles 1.0"), response.body());
    }
}

package in.flipcycle.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.flipcycle.config.ConfigLoader;
import in.flipcycle.config.FlipConfig;
import in.flipcycle.domain.signal.Direction;
import in.flipcycle.domain.signal.Signal;
import in.flipcycle.infrastructure.persistence.JsonMappers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the bootstrap helpers.
 *
 * Tests:
 * - Signal file loading with defaults for omitted fields
 * - Startup validation of out-of-range config
 * - Scheduler sized to the concurrent-cycle cap
 */
class AppTest {

    private final ObjectMapper mapper = JsonMappers.create();

    @Test
    void testLoadSignalsFillsDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("signals.json");
        Files.writeString(file, "[{"
            + "\"asset\": \"ETH/USDT\", \"entryLow\": 1950, \"entryHigh\": 2000,"
            + "\"targetPrice\": 2300, \"stopPrice\": 1900, \"capital\": 750, \"confidence\": 0.8"
            + "}, {"
            + "\"signalId\": \"SIG-7\", \"asset\": \"SOL/USDT\", \"direction\": \"BUY\","
            + "\"entryLow\": 140, \"entryHigh\": 145, \"targetPrice\": 170, \"stopPrice\": 135,"
            + "\"capital\": 300, \"confidence\": 0.7, \"patternClass\": \"WHALE_ACCUMULATION\","
            + "\"receivedAt\": \"2026-03-02T09:00:00Z\""
            + "}]");

        List<Signal> signals = App.loadSignals(mapper, file.toString());

        assertEquals(2, signals.size());
        Signal eth = signals.get(0);
        assertNotNull(eth.signalId());
        assertTrue(eth.signalId().startsWith("SIG-"));
        assertEquals(Direction.BUY, eth.direction());
        assertEquals("UNCLASSIFIED", eth.patternClass());
        assertEquals("file", eth.source());
        assertNotNull(eth.receivedAt());
        assertEquals(0, new BigDecimal("750").compareTo(eth.capital()));

        Signal sol = signals.get(1);
        assertEquals("SIG-7", sol.signalId());
        assertEquals("WHALE_ACCUMULATION", sol.patternClass());
        assertEquals("2026-03-02T09:00:00Z", sol.receivedAt().toString());
    }

    @Test
    void testNoSignalFile() {
        assertTrue(App.loadSignals(mapper, "").isEmpty());
        assertTrue(App.loadSignals(mapper, null).isEmpty());
    }

    @Test
    void testUnreadableSignalFile(@TempDir Path dir) {
        String missing = dir.resolve("missing.json").toString();

        assertThrows(IllegalStateException.class, () -> App.loadSignals(mapper, missing));
    }

    @Test
    void testSchedulerThreadsCoverEveryCycle() throws IOException {
        assertEquals(6, App.schedulerThreads(FlipConfig.defaults()));
        assertEquals(11, App.schedulerThreads(ConfigLoader.parse("{\"lifecycle\": {\"maxConcurrentCycles\": 10}}")));
    }

    @Test
    void testStartupValidation() throws IOException {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(FlipConfig.defaults()));

        FlipConfig broken = ConfigLoader.parse("{\"ladder\": {\"curve\": -1}}");
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(broken));
        assertTrue(e.getMessage().contains("ladder"));
    }
}

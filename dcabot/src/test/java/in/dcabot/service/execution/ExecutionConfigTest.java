package in.dcabot.service.execution;

import in.dcabot.domain.order.OrderStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("TERMINAL_WAIT_CAP_MS");
        System.clearProperty("MAX_REPRICE_ITERATIONS");
    }

    @Test
    void defaults() {
        ExecutionConfig config = ExecutionConfig.defaults();

        assertEquals(Duration.ofMillis(500), config.terminalPollInterval());
        assertEquals(Duration.ofSeconds(12), config.terminalWaitCap());
        assertEquals(Duration.ofSeconds(30), config.minInitialRest());
        assertEquals(500, config.maxRepriceIterations());
        assertEquals(2, config.defaultQuoteScale());
        assertEquals(8, config.defaultBaseScale());
        assertTrue(config.isTerminal(OrderStatus.FILLED));
        assertTrue(config.isTerminal(OrderStatus.FAILED));
        assertFalse(config.isTerminal(OrderStatus.OPEN));
        assertFalse(config.isTerminal(null));
    }

    @Test
    void customTerminalSet() {
        ExecutionConfig config = ExecutionConfig.builder()
            .terminalStatuses(Set.of(OrderStatus.FILLED))
            .build();

        assertTrue(config.isTerminal(OrderStatus.FILLED));
        assertFalse(config.isTerminal(OrderStatus.CANCELLED));
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class,
            () -> ExecutionConfig.builder().terminalPollInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> ExecutionConfig.builder().maxRepriceIterations(0));
        assertThrows(IllegalArgumentException.class,
            () -> ExecutionConfig.builder().terminalStatuses(Set.of()));
        assertThrows(IllegalArgumentException.class,
            () -> ExecutionConfig.builder().minInitialRest(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> ExecutionConfig.builder()
            .terminalPollInterval(Duration.ofSeconds(5))
            .terminalWaitCap(Duration.ofSeconds(1))
            .build());
    }

    @Test
    void zeroInitialRestIsAllowed() {
        assertEquals(Duration.ZERO, ExecutionConfig.builder().minInitialRest(Duration.ZERO).build().minInitialRest());
    }

    @Test
    void fromEnvReadsOverrides() {
        System.setProperty("TERMINAL_WAIT_CAP_MS", "3000");
        System.setProperty("MAX_REPRICE_ITERATIONS", "25");

        ExecutionConfig config = ExecutionConfig.fromEnv();

        assertEquals(Duration.ofSeconds(3), config.terminalWaitCap());
        assertEquals(25, config.maxRepriceIterations());
        assertEquals(Duration.ofMillis(500), config.terminalPollInterval());
    }
}

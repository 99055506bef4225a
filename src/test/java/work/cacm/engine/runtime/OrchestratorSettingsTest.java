package work.cacm.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import work.cacm.engine.worker.WorkerLifecycleManager;

class OrchestratorSettingsTest {
    @AfterEach
    void clearProperties() {
        System.clearProperty(OrchestratorSettings.STEP_TIMEOUT_PROPERTY);
        System.clearProperty(OrchestratorSettings.MAX_DELEGATION_DEPTH_PROPERTY);
        System.clearProperty(OrchestratorSettings.OUTPUT_CONFLICT_POLICY_PROPERTY);
    }

    @Test
    void defaultsWhenNothingIsSet() {
        var settings = OrchestratorSettings.fromSystemProperties();
        assertTrue(settings.stepTimeout().isEmpty());
        assertEquals(WorkerLifecycleManager.DEFAULT_MAX_DELEGATION_DEPTH, settings.maxDelegationDepth());
        assertEquals(OutputConflictPolicy.LAST_WRITE_WINS, settings.outputConflictPolicy());
    }

    @Test
    void readsSystemProperties() {
        System.setProperty(OrchestratorSettings.STEP_TIMEOUT_PROPERTY, "30s");
        System.setProperty(OrchestratorSettings.MAX_DELEGATION_DEPTH_PROPERTY, "3");
        System.setProperty(OrchestratorSettings.OUTPUT_CONFLICT_POLICY_PROPERTY, "reject");
        var settings = OrchestratorSettings.fromSystemProperties();
        assertEquals(Optional.of(Duration.ofSeconds(30)), settings.stepTimeout());
        assertEquals(3, settings.maxDelegationDepth());
        assertEquals(OutputConflictPolicy.REJECT, settings.outputConflictPolicy());
    }

    @Test
    void zeroTimeoutMeansNoTimeout() {
        assertTrue(OrchestratorSettings.builder().stepTimeout(Duration.ZERO).build().stepTimeout().isEmpty());
    }

    @Test
    void rejectsInvalidValues() {
        System.setProperty(OrchestratorSettings.MAX_DELEGATION_DEPTH_PROPERTY, "deep");
        assertThrows(IllegalArgumentException.class, OrchestratorSettings::fromSystemProperties);
        System.clearProperty(OrchestratorSettings.MAX_DELEGATION_DEPTH_PROPERTY);

        assertThrows(IllegalArgumentException.class, () -> OutputConflictPolicy.parse("first-wins"));
        assertEquals(OutputConflictPolicy.LAST_WRITE_WINS, OutputConflictPolicy.parse("last-write-wins"));
        assertThrows(IllegalArgumentException.class, () -> OrchestratorSettings.builder().maxDelegationDepth(-1).build());
    }
}

package io.jobwarden.config;

import io.jobwarden.monitor.HealthCheckOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class JobwardenPropertiesTest {

    @Test
    void defaultsMatchMonitoredSystem() {
        JobwardenProperties props = new JobwardenProperties();

        assertEquals("*/10 * * * *", props.getRunner().getRunEvery());
        assertEquals(Duration.ofMinutes(10), props.toRunnerOptions().cooldown());
        assertEquals(Map.of("ticket", "tickets"), props.getRunner().getEntityCollections());

        HealthCheckOptions options = props.toHealthCheckOptions();
        assertEquals(8000, options.backlogCeiling());
        assertEquals(Duration.ofMinutes(15), options.backlogMinAge());
        assertEquals(0, options.retryCeiling());
        assertEquals(2, options.failedJobDetailLimit());
        assertEquals(Duration.ofMinutes(5), options.schedulerGrace());
        assertEquals(Duration.ofMinutes(10), options.stuckImportThreshold());
        assertNull(options.importFailureWindow());
    }

    @Test
    void overridesAreCarriedIntoOptions() {
        JobwardenProperties props = new JobwardenProperties();
        props.getRunner().setZone("Europe/Berlin");
        props.getRunner().setCooldown(Duration.ofMinutes(20));
        props.getMonitoring().setBacklogCeiling(100);
        props.getMonitoring().setImportBackends(Map.of("Import::Ldap", true));

        HealthCheckOptions options = props.toHealthCheckOptions();

        assertEquals(Duration.ofMinutes(20), props.toRunnerOptions().cooldown());
        assertEquals(100, options.backlogCeiling());
        assertEquals(Map.of("Import::Ldap", true), options.importBackends());
        assertEquals(ZoneId.of("Europe/Berlin"), options.zone());
    }
}

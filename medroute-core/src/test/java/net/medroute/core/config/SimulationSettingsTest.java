package net.medroute.core.config;

import net.medroute.core.model.CareProfile;
import net.medroute.core.model.PatientType;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SimulationSettingsTest {

    @Test
    void defaults_match_documented_values() {
        var s = SimulationSettings.defaults();

        assertEquals(Duration.ofSeconds(30), s.simulationDuration());
        assertEquals(0.3, s.emergencyProbability());
        assertEquals(3, s.maxRetryAttempts());
        assertEquals(new CareProfile(2, 3, Duration.ofSeconds(12)), s.profileFor(PatientType.EMERGENCY));
        assertEquals(new CareProfile(1, 1, Duration.ofSeconds(6)), s.profileFor(PatientType.ROUTINE));
    }

    @Test
    void invalid_values_are_rejected() {
        var b = SimulationSettings.builder();
        assertThrows(IllegalArgumentException.class, () -> b.emergencyProbability(1.5).build());
        assertThrows(IllegalArgumentException.class,
                () -> SimulationSettings.builder().massEventSize(5, 2).build());
        assertThrows(IllegalArgumentException.class,
                () -> SimulationSettings.builder().simulationDuration(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> SimulationSettings.builder().travelTime(Duration.ofSeconds(2), Duration.ofSeconds(1)).build());
        assertThrows(IllegalArgumentException.class,
                () -> SimulationSettings.builder().maxRetryAttempts(-1).build());
    }

    @Test
    void to_builder_copies_and_overrides() {
        var base = SimulationSettings.defaults();
        var changed = base.toBuilder()
                .profile(PatientType.ROUTINE, new CareProfile(0, 0, Duration.ofMillis(100)))
                .build();

        assertEquals(base.simulationDuration(), changed.simulationDuration());
        assertEquals(Duration.ofMillis(100), changed.profileFor(PatientType.ROUTINE).lengthOfStay());
        assertEquals(Duration.ofSeconds(6), base.profileFor(PatientType.ROUTINE).lengthOfStay());
    }
}

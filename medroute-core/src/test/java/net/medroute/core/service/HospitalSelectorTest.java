package net.medroute.core.service;

import net.medroute.core.config.SimulationSettings;
import net.medroute.core.model.PatientType;
import net.medroute.core.model.ResourceSnapshot;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HospitalSelectorTest {

    final HospitalSelector selector = new HospitalSelector(SimulationSettings.defaults());

    @Test
    void critical_emergency_skips_full_and_understaffed_hospitals() {
        Map<String, ResourceSnapshot> snaps = new LinkedHashMap<>();
        snaps.put("hospital1", ResourceSnapshot.of(0, 5, 5, 8, 5, 15));
        snaps.put("hospital2", ResourceSnapshot.of(5, 5, 5, 5, 5, 10));
        snaps.put("hospital3", ResourceSnapshot.of(2, 2, 0, 3, 5, 8));

        assertEquals(Optional.of("hospital2"), selector.select(snaps, PatientType.EMERGENCY, 1));
    }

    @Test
    void highest_score_wins() {
        Map<String, ResourceSnapshot> snaps = new LinkedHashMap<>();
        snaps.put("busy", ResourceSnapshot.of(3, 5, 8, 8, 15, 15));   // 9+16+15-4 = 36
        snaps.put("idle", ResourceSnapshot.of(5, 5, 8, 8, 15, 15));   // 15+16+15-0 = 46

        assertEquals(Optional.of("idle"), selector.select(snaps, PatientType.ROUTINE, 4));
    }

    @Test
    void tie_goes_to_first_in_iteration_order() {
        var same = ResourceSnapshot.of(2, 4, 3, 3, 3, 3);
        Map<String, ResourceSnapshot> snaps = new LinkedHashMap<>();
        snaps.put("b", same);
        snaps.put("a", same);

        assertEquals(Optional.of("b"), selector.select(snaps, PatientType.ROUTINE, 3));
        assertEquals(Optional.of("b"), selector.select(snaps, PatientType.ROUTINE, 3));
    }

    @Test
    void empty_or_all_insufficient_yields_no_hospital() {
        assertTrue(selector.select(Map.of(), PatientType.ROUTINE, 3).isEmpty());

        Map<String, ResourceSnapshot> snaps = new LinkedHashMap<>();
        snaps.put("h1", ResourceSnapshot.of(0, 3, 3, 3, 3, 3));
        snaps.put("h2", ResourceSnapshot.of(3, 3, 1, 3, 3, 3));   // emergency 는 staff 2 필요
        assertTrue(selector.select(snaps, PatientType.EMERGENCY, 2).isEmpty());
    }

    @Test
    void severity_weight_doubles_score_for_critical_or_emergency() {
        var s = ResourceSnapshot.of(5, 5, 8, 8, 15, 15);

        assertEquals(46.0, HospitalSelector.score(s, PatientType.ROUTINE, 4));
        assertEquals(92.0, HospitalSelector.score(s, PatientType.ROUTINE, 2));
        assertEquals(92.0, HospitalSelector.score(s, PatientType.EMERGENCY, 3));
    }

    @Test
    void occupancy_is_penalised() {
        var half = ResourceSnapshot.of(2, 4, 0, 0, 0, 0);
        assertEquals(0.5, half.occupancy());
        assertEquals(6 - 5.0, HospitalSelector.score(half, PatientType.ROUTINE, 5));
    }
}

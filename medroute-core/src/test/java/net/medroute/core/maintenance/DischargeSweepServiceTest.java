package net.medroute.core.maintenance;

import net.medroute.core.ManualClock;
import net.medroute.core.config.SimulationSettings;
import net.medroute.core.model.PatientRequest;
import net.medroute.core.model.PatientType;
import net.medroute.core.service.AdmissionLedger;
import net.medroute.core.service.ResourcePool;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DischargeSweepServiceTest {

    @Test
    void sweep_runs_only_when_interval_elapsed() {
        var clock = new ManualClock();
        var ledger = new AdmissionLedger("h1", new ResourcePool(2, 2, 2), SimulationSettings.defaults(), clock);
        var sweeper = new DischargeSweepService(ledger, clock, Duration.ofSeconds(2));

        ledger.admit(new PatientRequest("R1", 4, "north", PatientType.ROUTINE));
        assertNull(sweeper.runIfDue());
        assertEquals(Duration.ofSeconds(2), sweeper.untilNext());

        clock.advance(Duration.ofSeconds(2));
        var first = sweeper.runIfDue();
        assertNotNull(first);
        assertEquals(0, first.discharged);

        clock.advance(Duration.ofSeconds(4));   // 재원 6s 경과
        var second = sweeper.runIfDue();
        assertEquals(1, second.discharged);
        assertEquals(2, second.bedsAvailable);
        assertEquals(2, second.staffAvailable);
        assertEquals(2, second.suppliesAvailable);
        assertEquals(clock.now(), second.timestamp);
    }

    @Test
    void until_next_never_negative() {
        var clock = new ManualClock();
        var ledger = new AdmissionLedger("h1", new ResourcePool(1, 1, 1), SimulationSettings.defaults(), clock);
        var sweeper = new DischargeSweepService(ledger, clock, Duration.ofSeconds(1));

        clock.advance(Duration.ofSeconds(5));
        assertEquals(Duration.ZERO, sweeper.untilNext());
    }
}

package net.medroute.adapter.mailbox;

import net.medroute.adapter.mailbox.actor.HospitalActor;
import net.medroute.core.config.SimulationSettings;
import net.medroute.core.maintenance.DischargeSweepService;
import net.medroute.core.model.CareProfile;
import net.medroute.core.model.PatientType;
import net.medroute.core.service.AdmissionLedger;
import net.medroute.core.service.ResourcePool;
import net.medroute.core.spi.Clock;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/** 실시간 액터 테스트 공통: 스레드 풀, 레지스트리, 짧은 재원 기간 설정 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected ExecutorService executor;
    protected MailboxRegistry registry;
    protected final Clock clock = Instant::now;
    private final List<HospitalActor> started = new ArrayList<>();

    @BeforeAll
    void startExecutor() {
        executor = Executors.newCachedThreadPool();
    }

    @BeforeEach
    void freshRegistry() {
        registry = new MailboxRegistry();
    }

    @AfterEach
    void stopActors() {
        started.forEach(HospitalActor::stop);
        started.clear();
    }

    @AfterAll
    void cleanup() {
        executor.shutdownNow();
    }

    protected static SimulationSettings.Builder fastSettings() {
        return SimulationSettings.builder()
                .resourceRecoveryInterval(Duration.ofMillis(25))
                .queryTimeout(Duration.ofSeconds(2))
                .admissionTimeout(Duration.ofSeconds(2))
                .transferTimeout(Duration.ofSeconds(2))
                .profile(PatientType.EMERGENCY, new CareProfile(2, 3, Duration.ofMillis(300)))
                .profile(PatientType.ROUTINE, new CareProfile(1, 1, Duration.ofMillis(150)));
    }

    protected HospitalActor startHospital(String name, int beds, int staff, int supplies, SimulationSettings settings) {
        var ledger = new AdmissionLedger(name, new ResourcePool(beds, staff, supplies), settings, clock);
        var sweeper = new DischargeSweepService(ledger, clock, settings.resourceRecoveryInterval());
        var actor = new HospitalActor(registry.register(name), registry, ledger, sweeper);
        executor.submit(actor);
        started.add(actor);
        return actor;
    }

    protected MailboxHospitalGateway client(String name) {
        return new MailboxHospitalGateway(registry.register(name), registry);
    }
}

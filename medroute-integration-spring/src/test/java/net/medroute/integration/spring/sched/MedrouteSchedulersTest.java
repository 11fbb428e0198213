package net.medroute.integration.spring.sched;

import net.medroute.adapter.mailbox.HospitalNetwork;
import net.medroute.adapter.mailbox.MailboxRegistry;
import net.medroute.core.config.SimulationSettings;
import net.medroute.core.model.ResourceSnapshot;
import net.medroute.core.spi.Sleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MedrouteSchedulersTest {

    MailboxRegistry registry;
    HospitalNetwork network;

    @BeforeEach
    void setUp() {
        registry = new MailboxRegistry();
        var settings = SimulationSettings.builder()
                .resourceRecoveryInterval(Duration.ofMillis(50))
                .build();
        network = HospitalNetwork.builder(settings, registry, Instant::now, Sleeper.system())
                .hospital("hospital1", 5, 8, 15)
                .hospital("hospital2", 3, 5, 10)
                .build();
    }

    @AfterEach
    void tearDown() {
        network.close();
    }

    @Test
    void monitor_queries_every_hospital_through_its_mailbox() throws Exception {
        network.start();
        var schedulers = new MedrouteSchedulers(network, registry);
        schedulers.setQueryTimeout(Duration.ofSeconds(2));

        var snapshots = schedulers.monitor();

        assertThat(snapshots).containsOnlyKeys("hospital1", "hospital2");
        assertThat(snapshots.get("hospital1")).isEqualTo(ResourceSnapshot.of(5, 5, 8, 8, 15, 15));
        assertThat(registry.isRegistered(MedrouteSchedulers.MONITOR_ADDRESS)).isTrue();
    }

    @Test
    void tick_skips_when_network_not_running() throws Exception {
        var schedulers = new MedrouteSchedulers(network, registry);
        schedulers.setQueryTimeout(Duration.ofSeconds(10));

        long t0 = System.nanoTime();
        schedulers.tick();

        // 병원 액터가 없으므로 조회했다면 타임아웃까지 기다렸을 것
        assertThat(Duration.ofNanos(System.nanoTime() - t0)).isLessThan(Duration.ofSeconds(1));
    }

    @Test
    void missing_hospital_is_left_out() throws Exception {
        var schedulers = new MedrouteSchedulers(network, registry);
        schedulers.setQueryTimeout(Duration.ofMillis(100));

        // 시작 전: 주소는 있지만 응답할 액터가 없다
        assertThat(schedulers.monitor()).isEmpty();
    }

    @Test
    void monitor_address_can_only_be_claimed_once() {
        new MedrouteSchedulers(network, registry);

        assertThatThrownBy(() -> new MedrouteSchedulers(network, registry))
                .isInstanceOf(IllegalStateException.class);
    }
}

package net.medroute.bootstrap.catalog;

import net.medroute.adapter.mailbox.MailboxRegistry;
import net.medroute.bootstrap.props.MedrouteProperties;
import net.medroute.core.config.SimulationSettings;
import net.medroute.core.spi.Sleeper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NetworkRegistrarTest {

    private final MailboxRegistry registry = new MailboxRegistry();
    private final NetworkRegistrar registrar =
            new NetworkRegistrar(registry, SimulationSettings.defaults(), Instant::now, Sleeper.system());

    @Test
    void registers_every_actor_address() {
        var network = new MedrouteProperties.Network();

        try (var built = registrar.register(network)) {
            assertThat(built.hospitalNames()).hasSize(3);
            assertThat(registry.isRegistered("hospital2")).isTrue();
            assertThat(registry.isRegistered("ambulance1")).isTrue();
        }
    }

    @Test
    void empty_hospital_list_is_rejected() {
        var network = new MedrouteProperties.Network();
        network.setHospitals(List.of());

        assertThatThrownBy(() -> registrar.register(network))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("hospitals");
    }

    @Test
    void null_ambulance_list_is_rejected_before_anything_registers() {
        var network = new MedrouteProperties.Network();
        network.setAmbulances(null);

        assertThatThrownBy(() -> registrar.register(network))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ambulances");
        assertThat(registry.isRegistered("hospital1")).isFalse();
    }

    @Test
    void blank_names_are_rejected() {
        var network = new MedrouteProperties.Network();
        network.setHospitals(List.of(new MedrouteProperties.HospitalDef(" ", 1, 1, 1)));

        assertThatThrownBy(() -> registrar.register(network)).isInstanceOf(IllegalArgumentException.class);

        var amb = new MedrouteProperties.Network();
        amb.setAmbulances(List.of(new MedrouteProperties.AmbulanceDef(null, 1L)));
        assertThatThrownBy(() -> registrar.register(amb)).isInstanceOf(IllegalArgumentException.class);
    }
}

package net.medroute.bootstrap.catalog;

import net.medroute.adapter.mailbox.HospitalNetwork;
import net.medroute.adapter.mailbox.MailboxRegistry;
import net.medroute.bootstrap.props.MedrouteProperties;
import net.medroute.core.config.SimulationSettings;
import net.medroute.core.spi.Clock;
import net.medroute.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 설정의 병원/앰뷸런스 목록으로 액터 네트워크를 조립 */
public class NetworkRegistrar {
    private static final Logger log = LoggerFactory.getLogger(NetworkRegistrar.class);

    private final MailboxRegistry registry;
    private final SimulationSettings settings;
    private final Clock clock;
    private final Sleeper sleeper;

    public NetworkRegistrar(MailboxRegistry registry,
                            SimulationSettings settings,
                            Clock clock,
                            Sleeper sleeper) {
        this.registry = registry;
        this.settings = settings;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public HospitalNetwork register(MedrouteProperties.Network network) {
        if (network.getHospitals() == null || network.getHospitals().isEmpty()) {
            throw new IllegalArgumentException("medroute.network.hospitals must not be empty");
        }
        if (network.getAmbulances() == null) {
            throw new IllegalArgumentException("medroute.network.ambulances must not be null");
        }

        var b = HospitalNetwork.builder(settings, registry, clock, sleeper);
        for (var h : network.getHospitals()) {
            if (h.getName() == null || h.getName().isBlank()) {
                throw new IllegalArgumentException("hospital.name is required");
            }
            b.hospital(h.getName(), h.getBeds(), h.getStaff(), h.getSupplies());
            log.info("Hospital registered: {} (beds {}, staff {}, supplies {})",
                    h.getName(), h.getBeds(), h.getStaff(), h.getSupplies());
        }
        for (var a : network.getAmbulances()) {
            if (a.getName() == null || a.getName().isBlank()) {
                throw new IllegalArgumentException("ambulance.name is required");
            }
            b.ambulance(a.getName(), a.getSeed());
            log.info("Ambulance registered: {}", a.getName());
        }
        return b.build();
    }
}

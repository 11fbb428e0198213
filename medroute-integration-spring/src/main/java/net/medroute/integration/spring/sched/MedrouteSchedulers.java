package net.medroute.integration.spring.sched;

import net.medroute.adapter.mailbox.HospitalNetwork;
import net.medroute.adapter.mailbox.MailboxHospitalGateway;
import net.medroute.adapter.mailbox.MailboxRegistry;
import net.medroute.core.model.ResourceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** 주기적으로 각 병원에 resource_query 를 보내 현황을 로그로 남긴다 (병원 상태는 메시지로만 읽음) */
public class MedrouteSchedulers {
    private static final Logger log = LoggerFactory.getLogger(MedrouteSchedulers.class);

    public static final String MONITOR_ADDRESS = "network-monitor";

    private final HospitalNetwork network;
    private final MailboxHospitalGateway gateway;

    private Duration queryTimeout = Duration.ofSeconds(5);
    private volatile Map<String, ResourceSnapshot> lastSnapshots = Map.of();

    public MedrouteSchedulers(HospitalNetwork network, MailboxRegistry registry) {
        this.network = network;
        this.gateway = new MailboxHospitalGateway(registry.register(MONITOR_ADDRESS), registry);
    }

    @Scheduled(fixedDelayString = "${medroute.scheduler.monitor-delay-ms:5000}")
    public void tick() throws InterruptedException {
        if (!network.isRunning()) return;
        monitor();
    }

    public synchronized Map<String, ResourceSnapshot> monitor() throws InterruptedException {
        Map<String, ResourceSnapshot> out = new LinkedHashMap<>();
        for (String hospital : network.hospitalNames()) {
            var snap = gateway.queryResources(hospital, queryTimeout);
            if (snap.isPresent()) {
                out.put(hospital, snap.get());
                log.info("[monitor] {} beds {}/{} staff {}/{} supplies {}/{} occupancy {}", hospital,
                        snap.get().bedsAvailable(), snap.get().bedsTotal(),
                        snap.get().staffAvailable(), snap.get().staffTotal(),
                        snap.get().suppliesAvailable(), snap.get().suppliesTotal(), snap.get().occupancy());
            } else {
                log.warn("[monitor] no reply from {}", hospital);
            }
        }
        lastSnapshots = Collections.unmodifiableMap(out);
        return lastSnapshots;
    }

    /** 마지막 모니터링 결과 (아직 없으면 빈 맵) */
    public Map<String, ResourceSnapshot> lastSnapshots() {
        return lastSnapshots;
    }

    public void setQueryTimeout(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }
}

package net.medroute.bootstrap.runner;

import net.medroute.adapter.mailbox.HospitalNetwork;
import net.medroute.core.report.NetworkReport;
import net.medroute.core.report.ReportFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.time.Duration;

/** 네트워크 시작 → 앰뷸런스 종료 대기 → 최종 리포트 로그 → 정지 */
public class SimulationRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SimulationRunner.class);

    private final HospitalNetwork network;
    private final Duration awaitTimeout;
    private volatile NetworkReport lastReport;

    public SimulationRunner(HospitalNetwork network, Duration awaitTimeout) {
        this.network = network;
        this.awaitTimeout = awaitTimeout;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        network.start();
        boolean done = network.awaitCompletion(awaitTimeout);
        if (!done) log.warn("simulation did not finish within {}, reporting partial results", awaitTimeout);

        NetworkReport report = network.report();
        ReportFormatter.format(report).forEach(log::info);
        lastReport = report;
        network.close();
    }

    /** run 이 끝나기 전이면 null */
    public NetworkReport lastReport() {
        return lastReport;
    }
}

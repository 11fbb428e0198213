package net.medroute.core.maintenance;

import net.medroute.core.service.AdmissionLedger;
import net.medroute.core.spi.Clock;

import java.time.Duration;
import java.time.Instant;

/** 병원 액터가 주기적으로 호출하는 퇴원/자원 회수 루틴 */
public final class DischargeSweepService {
    private final AdmissionLedger ledger;
    private final Clock clock;
    private final Duration interval;
    private Instant nextDueAt;

    public DischargeSweepService(AdmissionLedger ledger, Clock clock, Duration interval) {
        this.ledger = ledger;
        this.clock = clock;
        this.interval = interval;
        this.nextDueAt = clock.now().plus(interval);
    }

    /** 기한이 됐을 때만 스윕. 아니면 null */
    public SweepReport runIfDue() {
        Instant now = clock.now();
        if (now.isBefore(nextDueAt)) return null;
        return runOnce();
    }

    public SweepReport runOnce() {
        Instant now = clock.now();
        SweepReport r = new SweepReport();
        r.discharged = ledger.runDischargeSweep(now);

        var s = ledger.resourceSnapshot();
        r.bedsAvailable = s.bedsAvailable();
        r.staffAvailable = s.staffAvailable();
        r.suppliesAvailable = s.suppliesAvailable();
        r.timestamp = now;

        nextDueAt = now.plus(interval);
        return r;
    }

    /** 다음 스윕까지 남은 시간 (지났으면 0) */
    public Duration untilNext() {
        Duration d = Duration.between(clock.now(), nextDueAt);
        return d.isNegative() ? Duration.ZERO : d;
    }

    /** 간단 리포트 DTO */
    public static final class SweepReport {
        public Instant timestamp;
        public int discharged;
        public int bedsAvailable;
        public int staffAvailable;
        public int suppliesAvailable;

        @Override public String toString() {
            return "SweepReport{" +
                    "timestamp=" + timestamp +
                    ", discharged=" + discharged +
                    ", bedsAvailable=" + bedsAvailable +
                    ", staffAvailable=" + staffAvailable +
                    ", suppliesAvailable=" + suppliesAvailable +
                    '}';
        }
    }
}

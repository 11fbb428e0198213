package net.medroute.core.service;

import net.medroute.core.model.RejectReason;

import java.time.Duration;
import java.util.Map;

/** 앰뷸런스 한 대의 집계. 스케줄러가 만들어 내보내는 불변 스냅샷 */
public record DispatchStats(
        String ambulance,
        int generated,
        int treated,
        Map<RejectReason, Integer> rejectedByReason,   // 최종 실패만
        int retriesScheduled,
        int escalations,
        int massEvents,
        int fallbackAdmissions,
        Duration totalTransportTime,
        boolean finished
) {
    public DispatchStats {
        rejectedByReason = Map.copyOf(rejectedByReason);
    }

    public int rejected() {
        return rejectedByReason.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int rejected(RejectReason reason) {
        return rejectedByReason.getOrDefault(reason, 0);
    }

    public Duration averageTransportTime() {
        return treated == 0 ? Duration.ZERO : totalTransportTime.dividedBy(treated);
    }

    /** 0~100, 처리된 환자가 없으면 NaN */
    public double successRate() {
        int total = treated + rejected();
        return total == 0 ? Double.NaN : treated * 100.0 / total;
    }
}

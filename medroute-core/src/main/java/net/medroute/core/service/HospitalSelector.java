package net.medroute.core.service;

import net.medroute.core.config.SimulationSettings;
import net.medroute.core.model.CareProfile;
import net.medroute.core.model.PatientType;
import net.medroute.core.model.ResourceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 광고된(stale 일 수 있는) 스냅샷으로 목적지 병원을 고른다.
 * 자원이 부족한 병원은 제외, 점수 최대값, 동점이면 입력 순서상 먼저 나온 병원.
 */
public final class HospitalSelector {
    private static final Logger log = LoggerFactory.getLogger(HospitalSelector.class);

    private final SimulationSettings settings;

    public HospitalSelector(SimulationSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /** empty = NO_HOSPITAL (오류가 아닌 정상 결과) */
    public Optional<String> select(Map<String, ResourceSnapshot> snapshots, PatientType type, int severity) {
        CareProfile profile = settings.profileFor(type);
        String best = null;
        double bestScore = Double.NEGATIVE_INFINITY;

        for (var e : snapshots.entrySet()) {
            var shortfall = e.getValue().shortfallFor(profile);
            if (shortfall != null) {
                log.debug("skip {}: {}", e.getKey(), shortfall);
                continue;
            }
            double s = score(e.getValue(), type, severity);
            log.debug("candidate {} score={}", e.getKey(), s);
            if (s > bestScore) {   // 엄격 비교: 동점이면 앞선 병원 유지
                best = e.getKey();
                bestScore = s;
            }
        }
        return Optional.ofNullable(best);
    }

    public static double score(ResourceSnapshot s, PatientType type, int severity) {
        double base = s.bedsAvailable() * 3
                + s.staffAvailable() * 2
                + s.suppliesAvailable()
                - s.occupancy() * 10;
        return base * severityWeight(type, severity);
    }

    static int severityWeight(PatientType type, int severity) {
        return (severity <= 2 || type == PatientType.EMERGENCY) ? 2 : 1;
    }
}

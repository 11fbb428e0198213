package net.medroute.core.service;

import net.medroute.core.config.SimulationSettings;
import net.medroute.core.model.*;
import net.medroute.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * 병원 한 곳의 입원 원장.
 * 자원 풀, 재원 환자 집합, 카운터, 자원 이력을 소유한다.
 * 액터 스레드 하나에서 호출되지만 리포트 조회를 위해 모니터로 감싼다.
 */
public final class AdmissionLedger {
    private static final Logger log = LoggerFactory.getLogger(AdmissionLedger.class);

    public static final String DEFAULT_LOCATION = "unknown";
    public static final String TRANSFER_LOCATION = "transferred";

    private final String hospitalName;
    private final ResourcePool pool;
    private final SimulationSettings settings;
    private final Clock clock;

    private final Map<String, PatientRecord> active = new LinkedHashMap<>();
    private final List<ResourceHistoryEntry> history = new ArrayList<>();
    private final Map<RejectReason, Integer> rejectedByReason = new EnumMap<>(RejectReason.class);
    private int treated;
    private int dischargedCount;
    private Duration totalDischargeTime = Duration.ZERO;

    public AdmissionLedger(String hospitalName, ResourcePool pool, SimulationSettings settings, Clock clock) {
        this.hospitalName = Objects.requireNonNull(hospitalName, "hospitalName");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public AdmissionOutcome admit(PatientRequest request) {
        return admitInternal(request, DEFAULT_LOCATION, false);
    }

    /** 입원과 같은 경로, location 이 비어 있으면 "transferred" */
    public AdmissionOutcome handleTransfer(PatientRequest request) {
        return admitInternal(request, TRANSFER_LOCATION, true);
    }

    private synchronized AdmissionOutcome admitInternal(PatientRequest request, String defaultLocation, boolean transfer) {
        PatientType type = request.effectiveType();
        String location = (request.location() == null || request.location().isBlank()) ? defaultLocation : request.location();
        CareProfile profile = settings.profileFor(type);

        var reservation = pool.tryReserve(profile);
        if (!reservation.granted()) {
            rejectedByReason.merge(reservation.reason(), 1, Integer::sum);
            log.info("[{}] rejected {} (severity {}, {}): {}", hospitalName, request.id(), request.severity(),
                    type.code(), reservation.reason());
            return AdmissionOutcome.rejected(transfer, request.id(), reservation.reason(), hospitalName, type);
        }

        Instant now = clock.now();
        var record = new PatientRecord(request.id(), request.severity(), location, type, profile,
                now, profile.lengthOfStay());
        PatientRecord previous = active.put(record.id(), record);
        if (previous != null) {
            // 같은 id 가 재원 중이면 이전 예약분을 돌려준다
            pool.release(previous.profile());
            log.warn("[{}] patient {} re-admitted while active; previous reservation released", hospitalName, record.id());
        }
        treated++;
        appendHistory(now, ResourceHistoryEntry.Kind.ADMITTED, record.id());

        int bedsLeft = pool.bedsAvailable();
        log.info("[{}] admitted {} (severity {}, {}{}) beds {}/{}", hospitalName, record.id(), record.severity(),
                type.code(), transfer ? ", transfer" : "", bedsLeft, pool.bedsTotal());
        return AdmissionOutcome.accepted(transfer, record.id(), bedsLeft, hospitalName, type);
    }

    public ResourceSnapshot resourceSnapshot() {
        return pool.snapshot();
    }

    /** 재원 기간이 지난 환자를 퇴원 처리. 활성 집합의 복사본을 순회한다 */
    public synchronized int runDischargeSweep(Instant now) {
        int discharged = 0;
        for (PatientRecord r : List.copyOf(active.values())) {
            if (!r.dueForDischarge(now)) continue;

            pool.release(r.profile());
            active.remove(r.id());
            dischargedCount++;
            totalDischargeTime = totalDischargeTime.plus(Duration.between(r.admissionTime(), now));
            appendHistory(now, ResourceHistoryEntry.Kind.DISCHARGED, r.id());
            discharged++;
            log.info("[{}] discharged {} after {} ms", hospitalName, r.id(),
                    Duration.between(r.admissionTime(), now).toMillis());
        }
        return discharged;
    }

    private void appendHistory(Instant at, ResourceHistoryEntry.Kind kind, String patientId) {
        var s = pool.snapshot();
        history.add(new ResourceHistoryEntry(at, kind, patientId,
                s.bedsAvailable(), s.staffAvailable(), s.suppliesAvailable()));
    }

    public String hospitalName() { return hospitalName; }

    public synchronized List<ResourceHistoryEntry> history() { return List.copyOf(history); }

    public synchronized List<PatientRecord> activePatients() { return List.copyOf(active.values()); }

    public synchronized int treated() { return treated; }

    public synchronized int dischargedCount() { return dischargedCount; }

    public synchronized Duration totalDischargeTime() { return totalDischargeTime; }

    public synchronized Map<RejectReason, Integer> rejectedByReason() {
        return rejectedByReason.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(rejectedByReason));
    }

    public synchronized int rejectedTotal() {
        return rejectedByReason.values().stream().mapToInt(Integer::intValue).sum();
    }

    public synchronized Duration averageStay() {
        return dischargedCount == 0 ? Duration.ZERO : totalDischargeTime.dividedBy(dischargedCount);
    }
}

package net.medroute.core.service;

import net.medroute.core.config.SimulationSettings;
import net.medroute.core.model.*;
import net.medroute.core.spi.Clock;
import net.medroute.core.spi.HospitalGateway;
import net.medroute.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * 앰뷸런스 한 대의 디스패치 루프 (단일 스레드, 한 번 실행 후 종료).
 *
 * 틱마다: (1) 기한이 된 재시도 (2) 대량 사상자 배치 잔여분 (3) 시뮬레이션 창이 열려 있으면 신규 생성
 * (4) 창이 닫혔으면 남은 재시도가 빌 때까지 대기 후 처리 (5) 종료.
 *
 * 환자별 상태: PENDING → DISPATCHED → ACCEPTED | REJECTED → RETRY_PENDING → PENDING | TERMINAL
 */
public final class DispatchScheduler {
    private static final Logger log = LoggerFactory.getLogger(DispatchScheduler.class);

    private static final Comparator<DispatchAttempt> BY_DUE =
            Comparator.comparing(DispatchAttempt::nextAttemptTime)
                    .thenComparingLong(DispatchAttempt::sequence);

    private final String ambulanceName;
    private final List<String> hospitals;
    private final HospitalGateway gateway;
    private final HospitalSelector selector;
    private final PatientGenerator generator;
    private final RetryPolicy retryPolicy;
    private final SimulationSettings settings;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Random travelRandom;

    private final PriorityQueue<DispatchAttempt> retryQueue = new PriorityQueue<>(BY_DUE);
    private final Deque<PatientRequest> batchQueue = new ArrayDeque<>();
    private long sequence;
    private Instant windowEnd;

    // 집계 (stats() 는 다른 스레드에서 읽을 수 있다)
    private final Map<RejectReason, Integer> rejectedByReason = new EnumMap<>(RejectReason.class);
    private int generated;
    private int treated;
    private int retriesScheduled;
    private int escalations;
    private int massEvents;
    private int fallbackAdmissions;
    private Duration totalTransportTime = Duration.ZERO;
    private boolean finished;

    public DispatchScheduler(String ambulanceName,
                             List<String> hospitals,
                             HospitalGateway gateway,
                             HospitalSelector selector,
                             PatientGenerator generator,
                             RetryPolicy retryPolicy,
                             SimulationSettings settings,
                             Clock clock,
                             Sleeper sleeper,
                             Random travelRandom) {
        this.ambulanceName = Objects.requireNonNull(ambulanceName, "ambulanceName");
        this.hospitals = List.copyOf(hospitals);
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.travelRandom = Objects.requireNonNull(travelRandom, "travelRandom");
    }

    /** 창이 닫히고 재시도 대기가 모두 빠질 때까지 실행, 최종 집계 반환 */
    public DispatchStats run() throws InterruptedException {
        windowEnd = clock.now().plus(settings.simulationDuration());
        log.info("[{}] dispatch loop started, hospitals={}, window ends {}", ambulanceName, hospitals, windowEnd);

        while (true) {
            Instant now = clock.now();
            DispatchAttempt head = retryQueue.peek();

            if (head != null && head.readyAt(now)) {
                retryQueue.poll();
                process(head);
            } else if (!batchQueue.isEmpty()) {
                process(DispatchAttempt.fresh(batchQueue.poll(), now, sequence++));
            } else if (now.isBefore(windowEnd)) {
                generate();
                continue;
            } else if (head != null) {
                // 창 종료 후 드레인: 다음 재시도 시각까지 대기
                sleeper.sleep(Duration.between(now, head.nextAttemptTime()));
                continue;
            } else {
                break;
            }

            if (clock.now().isBefore(windowEnd)) {
                sleeper.sleep(settings.patientInterval());
            }
        }

        synchronized (this) { finished = true; }
        DispatchStats s = stats();
        log.info("[{}] finished: generated={} treated={} rejected={} retries={} avgTransport={}ms",
                ambulanceName, s.generated(), s.treated(), s.rejectedByReason(), s.retriesScheduled(),
                s.averageTransportTime().toMillis());
        return s;
    }

    private void generate() {
        var batch = generator.next(!retryQueue.isEmpty());
        synchronized (this) {
            generated += batch.patients().size();
            if (batch.massEvent()) massEvents++;
        }
        if (batch.massEvent()) {
            log.info("[{}] mass casualty event: {} emergency patients", ambulanceName, batch.patients().size());
        }
        batchQueue.addAll(batch.patients());
    }

    private void process(DispatchAttempt attempt) throws InterruptedException {
        PatientRequest req = attempt.request();
        log.info("[{}] processing {} (severity {}, {}, attempt {})", ambulanceName, req.id(), req.severity(),
                req.effectiveType().code(), attempt.retries() + 1);

        DispatchResult result = dispatch(req);
        if (result.accepted()) {
            synchronized (this) {
                treated++;
                totalTransportTime = totalTransportTime.plus(result.transportTime());
                if (result.fallback()) fallbackAdmissions++;
            }
            log.info("[{}] {} admitted at {}", ambulanceName, req.id(), result.hospital());
            return;
        }

        RejectReason reason = result.reason();
        int nextRetry = attempt.retries() + 1;
        Instant next = clock.now().plus(retryPolicy.nextBackoff(nextRetry));
        boolean inWindow = !next.isAfter(windowEnd.plus(settings.retryGracePeriod()));

        if (reason.retryable() && attempt.retries() < settings.maxRetryAttempts() && inWindow) {
            PatientRequest escalated = escalate(req);
            synchronized (this) {
                retriesScheduled++;
                if (!escalated.equals(req)) escalations++;
            }
            retryQueue.add(attempt.retryAt(escalated, next, sequence++));
            log.info("[{}] {} {} -> retry {}/{} at {} (severity {}, {})", ambulanceName, req.id(), reason,
                    nextRetry, settings.maxRetryAttempts(), next, escalated.severity(), escalated.effectiveType().code());
        } else {
            synchronized (this) { rejectedByReason.merge(reason, 1, Integer::sum); }
            log.info("[{}] {} NOT admitted: {} after {} attempt(s)", ambulanceName, req.id(), reason, nextRetry);
        }
    }

    /** 조회 → 선택 → 이동 → 입원 요청. 명시적 거절일 때만 나머지 병원을 목록 순서로 시도 (스냅샷 재조회 없음) */
    private DispatchResult dispatch(PatientRequest req) throws InterruptedException {
        Map<String, ResourceSnapshot> snapshots = queryAll();
        var target = selector.select(snapshots, req.effectiveType(), req.severity());
        if (target.isEmpty()) {
            log.info("[{}] no hospital can take {} ({} snapshots)", ambulanceName, req.id(), snapshots.size());
            return DispatchResult.failed(RejectReason.NO_HOSPITAL);
        }

        List<String> order = new ArrayList<>(hospitals.size());
        order.add(target.get());
        for (String h : hospitals) {
            if (!h.equals(target.get())) order.add(h);
        }

        RejectReason primary = null;
        for (int i = 0; i < order.size(); i++) {
            String hospital = order.get(i);
            sleeper.sleep(travelTime());
            Instant sent = clock.now();
            RejectReason reason = sendAdmission(hospital, req);
            if (reason == null) {
                // 수송 시간: 수락한 병원에 보낸 시점부터 응답까지
                return DispatchResult.accepted(hospital, Duration.between(sent, clock.now()), i > 0);
            }
            if (i == 0 && reason == RejectReason.TIMEOUT) {
                // 늦게 수락했을 수 있으므로 다른 병원으로 넘기지 않고 재시도 정책에 맡긴다
                return DispatchResult.failed(reason);
            }
            if (primary == null) primary = reason;
            log.debug("[{}] {} rejected by {}: {}", ambulanceName, req.id(), hospital, reason);
        }
        return DispatchResult.failed(primary);
    }

    /** null = 수락 */
    private RejectReason sendAdmission(String hospital, PatientRequest req) throws InterruptedException {
        try {
            var reply = gateway.requestAdmission(hospital, req, settings.admissionTimeout());
            if (reply.isEmpty()) {
                log.warn("[{}] TIMEOUT waiting for {} on {}", ambulanceName, hospital, req.id());
                return RejectReason.TIMEOUT;
            }
            AdmissionOutcome outcome = reply.get();
            if (outcome.accepted()) return null;
            return outcome.reason() == null ? RejectReason.INVALID_REPLY : outcome.reason();
        } catch (InterruptedException ie) {
            throw ie;
        } catch (Exception e) {
            log.warn("[{}] admission exchange with {} failed: {}", ambulanceName, hospital, e.toString());
            return RejectReason.TIMEOUT;
        }
    }

    /** 응답 없는 병원은 맵에서 빠질 뿐 오류가 아니다 */
    private Map<String, ResourceSnapshot> queryAll() throws InterruptedException {
        Map<String, ResourceSnapshot> out = new LinkedHashMap<>();
        for (String h : hospitals) {
            try {
                var snap = gateway.queryResources(h, settings.queryTimeout());
                if (snap.isPresent()) {
                    out.put(h, snap.get());
                    log.debug("[{}] resources of {}: {}", ambulanceName, h, snap.get());
                } else {
                    log.warn("[{}] no resource reply from {}", ambulanceName, h);
                }
            } catch (InterruptedException ie) {
                throw ie;
            } catch (Exception e) {
                log.warn("[{}] resource query to {} failed: {}", ambulanceName, h, e.toString());
            }
        }
        return out;
    }

    private Duration travelTime() {
        long min = settings.travelTimeMin().toMillis();
        long span = settings.travelTimeMax().toMillis() - min;
        long extra = span <= 0 ? 0 : (long) (travelRandom.nextDouble() * (span + 1));
        return Duration.ofMillis(min + Math.min(extra, span));
    }

    /** routine 환자: 중증도 > 2 면 1 낮추고, 2 이하가 되면 emergency 로 재분류 */
    static PatientRequest escalate(PatientRequest req) {
        if (req.effectiveType() != PatientType.ROUTINE) return req;
        int severity = req.severity() > 2 ? req.severity() - 1 : req.severity();
        PatientType type = severity <= 2 ? PatientType.EMERGENCY : PatientType.ROUTINE;
        return new PatientRequest(req.id(), severity, req.location(), type);
    }

    public synchronized DispatchStats stats() {
        return new DispatchStats(ambulanceName, generated, treated, rejectedByReason, retriesScheduled,
                escalations, massEvents, fallbackAdmissions, totalTransportTime, finished);
    }

    public String ambulanceName() { return ambulanceName; }

    private record DispatchResult(boolean accepted, String hospital, Duration transportTime,
                                  boolean fallback, RejectReason reason) {
        static DispatchResult accepted(String hospital, Duration transportTime, boolean fallback) {
            return new DispatchResult(true, hospital, transportTime, fallback, null);
        }

        static DispatchResult failed(RejectReason reason) {
            return new DispatchResult(false, null, Duration.ZERO, false, reason);
        }
    }
}

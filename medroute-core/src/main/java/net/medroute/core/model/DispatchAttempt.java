package net.medroute.core.model;

import java.time.Instant;

/**
 * 앰뷸런스 스케줄러가 소유하는 재시도 단위.
 * 상태 전이는 새 인스턴스를 돌려준다.
 */
public record DispatchAttempt(
        PatientRequest request,
        int retries,
        Instant nextAttemptTime,
        long sequence            // 같은 시각일 때 삽입 순서 보장
) {
    public static DispatchAttempt fresh(PatientRequest request, Instant now, long sequence) {
        return new DispatchAttempt(request, 0, now, sequence);
    }

    public boolean readyAt(Instant now) {
        return !nextAttemptTime.isAfter(now);
    }

    public DispatchAttempt retryAt(PatientRequest escalated, Instant next, long seq) {
        return new DispatchAttempt(escalated, retries + 1, next, seq);
    }
}

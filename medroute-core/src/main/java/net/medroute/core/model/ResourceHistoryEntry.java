package net.medroute.core.model;

import java.time.Instant;

/** 입원/퇴원 직후의 풀 수준 기록 (append-only) */
public record ResourceHistoryEntry(
        Instant timestamp,
        Kind kind,
        String patientId,
        int bedsAvailable,
        int staffAvailable,
        int suppliesAvailable
) {
    public enum Kind { ADMITTED, DISCHARGED }
}

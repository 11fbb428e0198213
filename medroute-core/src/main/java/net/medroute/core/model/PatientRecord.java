package net.medroute.core.model;

import java.time.Duration;
import java.time.Instant;

public record PatientRecord(
        String id,
        int severity,
        String location,
        PatientType type,
        CareProfile profile,       // 퇴원 시 정확히 이만큼 반납
        Instant admissionTime,
        Duration lengthOfStay
) {
    public boolean dueForDischarge(Instant now) {
        return Duration.between(admissionTime, now).compareTo(lengthOfStay) >= 0;
    }

    public String severityLabel() {
        return switch (severity) {
            case 1 -> "CRITICAL";
            case 2 -> "URGENT";
            case 3 -> "MEDIUM";
            case 4 -> "LOW";
            default -> "MINIMAL";
        };
    }
}

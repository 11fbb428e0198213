package net.medroute.core.model;

import java.time.Duration;
import java.util.Objects;

/** 환자 타입별 고정 자원 비용(침대 1개는 항상 포함)과 재원 기간 */
public record CareProfile(
        int staff,
        int supplies,
        Duration lengthOfStay
) {
    public CareProfile {
        Objects.requireNonNull(lengthOfStay, "lengthOfStay");
        if (staff < 0 || supplies < 0) throw new IllegalArgumentException("profile cost must be >= 0");
        if (lengthOfStay.isNegative()) throw new IllegalArgumentException("lengthOfStay must be >= 0");
    }

    public static final int BEDS = 1;
}

package net.medroute.core.model;

/**
 * 입원/전원 요청에 실리는 환자 정보.
 * 수신측에서는 location/type 이 null 일 수 있다(원장에서 기본값 적용).
 */
public record PatientRequest(
        String id,
        int severity,          // 1(가장 위급) ~ 5
        String location,
        PatientType type
) {
    public static final int MIN_SEVERITY = 1;
    public static final int MAX_SEVERITY = 5;
    public static final int DEFAULT_SEVERITY = 3;

    public PatientType effectiveType() {
        return type != null ? type : PatientType.infer(severity);
    }

    public PatientRequest withSeverity(int s) {
        return new PatientRequest(id, s, location, type);
    }

    public PatientRequest withType(PatientType t) {
        return new PatientRequest(id, severity, location, t);
    }

    public static boolean validSeverity(int s) {
        return s >= MIN_SEVERITY && s <= MAX_SEVERITY;
    }
}

package net.medroute.core.model;

public enum PatientType {
    EMERGENCY, ROUTINE;

    /** 타입 정보가 없을 때: 중증도 1~2 는 응급 */
    public static PatientType infer(int severity) {
        return severity <= 2 ? EMERGENCY : ROUTINE;
    }

    /** 모르는 값이면 null (호출측에서 infer) */
    public static PatientType from(String s) {
        if (s == null || s.isBlank()) return null;
        try { return PatientType.valueOf(s.trim().toUpperCase()); } catch (IllegalArgumentException e) { return null; }
    }

    public String code() { return name().toLowerCase(); }
}

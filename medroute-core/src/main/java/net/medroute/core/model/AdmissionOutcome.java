package net.medroute.core.model;

public record AdmissionOutcome(
        boolean accepted,
        boolean transfer,
        String patientId,
        int bedsRemaining,        // 수락일 때만 의미 있음
        RejectReason reason,      // 거절일 때만
        String hospitalName,
        PatientType patientType
) {
    public static AdmissionOutcome accepted(boolean transfer, String patientId, int bedsRemaining,
                                            String hospitalName, PatientType type) {
        return new AdmissionOutcome(true, transfer, patientId, bedsRemaining, null, hospitalName, type);
    }

    public static AdmissionOutcome rejected(boolean transfer, String patientId, RejectReason reason,
                                            String hospitalName, PatientType type) {
        return new AdmissionOutcome(false, transfer, patientId, -1, reason, hospitalName, type);
    }
}

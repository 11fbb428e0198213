package net.medroute.core.report;

import net.medroute.core.model.PatientRecord;
import net.medroute.core.model.RejectReason;
import net.medroute.core.model.ResourceSnapshot;
import net.medroute.core.service.AdmissionLedger;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public record HospitalSummary(
        String name,
        int admitted,
        Map<RejectReason, Integer> rejectedByReason,
        int discharged,
        Duration averageStay,
        ResourceSnapshot resources,
        List<PatientRecord> currentPatients
) {
    public static HospitalSummary of(AdmissionLedger ledger) {
        return new HospitalSummary(ledger.hospitalName(), ledger.treated(), ledger.rejectedByReason(),
                ledger.dischargedCount(), ledger.averageStay(), ledger.resourceSnapshot(), ledger.activePatients());
    }

    public int rejected() {
        return rejectedByReason.values().stream().mapToInt(Integer::intValue).sum();
    }
}

package net.medroute.core.report;

import net.medroute.core.model.PatientRecord;
import net.medroute.core.service.DispatchStats;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** 사람이 읽는 최종 리포트 줄 목록 */
public final class ReportFormatter {
    private ReportFormatter() {}

    public static List<String> format(NetworkReport report) {
        List<String> lines = new ArrayList<>();
        lines.add("==== SIMULATION REPORT ====");

        for (HospitalSummary h : report.hospitals()) {
            var r = h.resources();
            lines.add("Hospital " + h.name());
            lines.add("  admitted: " + h.admitted() + ", rejected: " + h.rejected() + " " + h.rejectedByReason());
            lines.add("  discharged: " + h.discharged() + ", average stay: " + h.averageStay().toMillis() + "ms");
            lines.add(String.format(Locale.ROOT, "  beds %d/%d, staff %d/%d, supplies %d/%d, occupancy %.2f",
                    r.bedsAvailable(), r.bedsTotal(), r.staffAvailable(), r.staffTotal(),
                    r.suppliesAvailable(), r.suppliesTotal(), r.occupancy()));
            for (PatientRecord p : h.currentPatients()) {
                lines.add("    - " + p.id() + " (severity " + p.severity() + " " + p.severityLabel() + ", " + p.type().code() + ")");
            }
        }

        for (DispatchStats a : report.ambulances()) {
            lines.add("Ambulance " + a.ambulance() + (a.finished() ? "" : " (unfinished)"));
            lines.add("  generated: " + a.generated() + " (mass events: " + a.massEvents() + ")"
                    + ", treated: " + a.treated() + ", rejected: " + a.rejected() + " " + a.rejectedByReason());
            lines.add("  retries: " + a.retriesScheduled() + ", escalations: " + a.escalations()
                    + ", fallback admissions: " + a.fallbackAdmissions()
                    + ", avg transport: " + a.averageTransportTime().toMillis() + "ms"
                    + ", success rate: " + percent(a.successRate()));
        }

        lines.add("Global: treated " + report.patientsTreated() + ", rejected " + report.patientsRejected()
                + ", success rate " + percent(report.successRate())
                + String.format(Locale.ROOT, ", bed utilization %.1f%%", report.bedUtilization()));
        return lines;
    }

    private static String percent(double v) {
        return Double.isNaN(v) ? "N/A" : String.format(Locale.ROOT, "%.1f%%", v);
    }
}

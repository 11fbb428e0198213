package net.medroute.core.report;

import net.medroute.core.service.DispatchStats;

import java.util.List;

/** 시뮬레이션 종료 시점 전체 집계 */
public record NetworkReport(
        List<HospitalSummary> hospitals,
        List<DispatchStats> ambulances
) {
    public NetworkReport {
        hospitals = List.copyOf(hospitals);
        ambulances = List.copyOf(ambulances);
    }

    public int hospitalAdmissions() {
        return hospitals.stream().mapToInt(HospitalSummary::admitted).sum();
    }

    public int hospitalRejections() {
        return hospitals.stream().mapToInt(HospitalSummary::rejected).sum();
    }

    public int patientsGenerated() {
        return ambulances.stream().mapToInt(DispatchStats::generated).sum();
    }

    public int patientsTreated() {
        return ambulances.stream().mapToInt(DispatchStats::treated).sum();
    }

    public int patientsRejected() {
        return ambulances.stream().mapToInt(DispatchStats::rejected).sum();
    }

    /** 앰뷸런스 관점 성공률(0~100). 최종 결과가 하나도 없으면 NaN */
    public double successRate() {
        int total = patientsTreated() + patientsRejected();
        return total == 0 ? Double.NaN : patientsTreated() * 100.0 / total;
    }

    public double bedUtilization() {
        int total = hospitals.stream().mapToInt(h -> h.resources().bedsTotal()).sum();
        int available = hospitals.stream().mapToInt(h -> h.resources().bedsAvailable()).sum();
        return total == 0 ? 0.0 : (total - available) * 100.0 / total;
    }
}

package net.medroute.adapter.mailbox.codec;

import net.medroute.core.model.AdmissionOutcome;
import net.medroute.core.model.PatientRequest;
import net.medroute.core.model.PatientType;
import net.medroute.core.model.RejectReason;
import net.medroute.core.model.ResourceSnapshot;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 파이프 구분 본문 ↔ 도메인 값.
 * 요청 본문은 관대하게 파싱(기본값), 응답 본문은 해석 못 하면 INVALID_REPLY.
 */
public final class MessageCodec {
    public static final String QUERY_BODY = "resource_query";

    static final String ACCEPTED = "ACCEPTED";
    static final String REJECTED = "REJECTED";
    static final String TRANSFER_ACCEPTED = "TRANSFER_ACCEPTED";
    static final String TRANSFER_REJECTED = "TRANSFER_REJECTED";

    private static final String UNKNOWN_ID = "unknown";

    private MessageCodec() {}

    // === resource query response ===

    /** beds:a/t|staff:a/t|supplies:a/t|occupancy:0.40 */
    public static String formatSnapshot(ResourceSnapshot s) {
        return "beds:" + s.bedsAvailable() + "/" + s.bedsTotal()
                + "|staff:" + s.staffAvailable() + "/" + s.staffTotal()
                + "|supplies:" + s.suppliesAvailable() + "/" + s.suppliesTotal()
                + "|occupancy:" + String.format(Locale.ROOT, "%.2f", s.occupancy());
    }

    /** 형식이 깨졌으면 empty (응답 없음과 같게 취급) */
    public static Optional<ResourceSnapshot> parseSnapshot(String body) {
        if (body == null || body.isBlank()) return Optional.empty();
        Map<String, String> fields = new HashMap<>();
        for (String item : body.split("\\|")) {
            int idx = item.indexOf(':');
            if (idx > 0) fields.put(item.substring(0, idx).trim(), item.substring(idx + 1).trim());
        }
        try {
            int[] beds = pair(fields.get("beds"));
            int[] staff = pair(fields.get("staff"));
            int[] supplies = pair(fields.get("supplies"));
            if (beds == null || staff == null || supplies == null) return Optional.empty();

            String occ = fields.get("occupancy");
            if (occ == null) {
                return Optional.of(ResourceSnapshot.of(beds[0], beds[1], staff[0], staff[1], supplies[0], supplies[1]));
            }
            return Optional.of(new ResourceSnapshot(beds[0], beds[1], staff[0], staff[1], supplies[0], supplies[1],
                    ResourceSnapshot.roundOccupancy(Double.parseDouble(occ))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /** "a/t" 또는 "a"(total 생략 시 a) */
    private static int[] pair(String v) {
        if (v == null) return null;
        int slash = v.indexOf('/');
        if (slash < 0) {
            int a = Integer.parseInt(v);
            return new int[]{a, a};
        }
        return new int[]{Integer.parseInt(v.substring(0, slash).trim()), Integer.parseInt(v.substring(slash + 1).trim())};
    }

    // === admission / transfer request ===

    /** id|severity|location|type (없는 값은 빈 칸) */
    public static String formatRequest(PatientRequest r) {
        return r.id() + "|" + r.severity() + "|"
                + (r.location() == null ? "" : r.location()) + "|"
                + (r.type() == null ? "" : r.type().code());
    }

    /**
     * 깨진 본문은 필드별 기본값: severity 3, location null(원장이 unknown/transferred 로 채움),
     * type null(중증도로 추론), id 가 비면 "unknown".
     */
    public static PatientRequest parseRequest(String body) {
        if (body == null || body.isBlank()) {
            return new PatientRequest(UNKNOWN_ID, PatientRequest.DEFAULT_SEVERITY, null, null);
        }
        String[] p = body.split("\\|", -1);
        String id = p[0].isBlank() ? UNKNOWN_ID : p[0].trim();

        int severity = p.length > 1 ? parseSeverity(p[1]) : PatientRequest.DEFAULT_SEVERITY;
        String location = (p.length > 2 && !p[2].isBlank()) ? p[2].trim() : null;
        PatientType type = p.length > 3 ? PatientType.from(p[3]) : null;
        return new PatientRequest(id, severity, location, type);
    }

    private static int parseSeverity(String v) {
        try {
            int s = Integer.parseInt(v.trim());
            return PatientRequest.validSeverity(s) ? s : PatientRequest.DEFAULT_SEVERITY;
        } catch (NumberFormatException e) {
            return PatientRequest.DEFAULT_SEVERITY;
        }
    }

    // === admission / transfer response ===

    public static String formatOutcome(AdmissionOutcome o) {
        String type = o.patientType() == null ? "" : o.patientType().code();
        if (o.accepted()) {
            return (o.transfer() ? TRANSFER_ACCEPTED : ACCEPTED) + "|" + o.patientId() + "|" + o.bedsRemaining()
                    + "|" + o.hospitalName() + "|" + type;
        }
        return (o.transfer() ? TRANSFER_REJECTED : REJECTED) + "|" + o.patientId() + "|" + o.reason().name()
                + "|" + o.hospitalName() + "|" + type;
    }

    /** status 메타데이터가 accepted 이거나 본문 접두어가 ACCEPTED 계열이면 수락 */
    public static AdmissionOutcome parseOutcome(String body, String status) {
        String[] p = body == null ? new String[]{""} : body.split("\\|", -1);
        String head = p[0].trim();
        boolean transfer = head.startsWith("TRANSFER_");
        String patientId = p.length > 1 ? p[1] : null;
        String hospital = p.length > 3 ? p[3] : null;
        PatientType type = p.length > 4 ? PatientType.from(p[4]) : null;

        boolean accepted = "accepted".equalsIgnoreCase(status) || ACCEPTED.equals(head) || TRANSFER_ACCEPTED.equals(head);
        if (accepted) {
            int beds = p.length > 2 ? parseBeds(p[2]) : -1;
            return AdmissionOutcome.accepted(transfer, patientId, beds, hospital, type);
        }
        RejectReason reason = (REJECTED.equals(head) || TRANSFER_REJECTED.equals(head)) && p.length > 2
                ? RejectReason.from(p[2]) : RejectReason.INVALID_REPLY;
        return AdmissionOutcome.rejected(transfer, patientId, reason, hospital, type);
    }

    private static int parseBeds(String v) {
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}

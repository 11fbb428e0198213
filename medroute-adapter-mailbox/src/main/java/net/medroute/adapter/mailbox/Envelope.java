package net.medroute.adapter.mailbox;

import java.util.Map;

/** 액터 간 메시지. metadata 의 type/status 가 메시지 종류와 결과를 구분한다 */
public record Envelope(
        String sender,
        String receiver,
        String conversationId,   // 응답이 요청과 짝을 맞추는 키
        Map<String, String> metadata,
        String body
) {
    public static final String TYPE = "type";
    public static final String STATUS = "status";

    public static final String RESOURCE_QUERY = "resource_query";
    public static final String ADMISSION_REQUEST = "admission_request";
    public static final String PATIENT_TRANSFER = "patient_transfer";
    public static final String RESOURCE_RESPONSE = "resource_response";
    public static final String ADMISSION_RESPONSE = "admission_response";
    public static final String TRANSFER_RESPONSE = "transfer_response";
    public static final String STOP = "stop";     // 내부 제어용: 수신 대기 중인 액터 깨우기

    public static final String ACCEPTED = "accepted";
    public static final String REJECTED = "rejected";

    public Envelope {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String type() { return metadata.get(TYPE); }

    public String status() { return metadata.get(STATUS); }

    public static Envelope request(String sender, String receiver, String conversationId, String type, String body) {
        return new Envelope(sender, receiver, conversationId, type == null ? Map.of() : Map.of(TYPE, type), body);
    }

    public Envelope reply(String type, String status, String body) {
        Map<String, String> md = status == null ? Map.of(TYPE, type) : Map.of(TYPE, type, STATUS, status);
        return new Envelope(receiver, sender, conversationId, md, body);
    }
}

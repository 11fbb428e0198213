package net.medroute.adapter.mailbox;

import net.medroute.core.model.PatientRequest;
import net.medroute.core.model.PatientType;
import net.medroute.core.model.RejectReason;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MailboxHospitalGatewayTest extends TestSupport {

    // ========== t1: 받는 쪽이 없으면 즉시 empty ==========
    @Test
    void t1_unknown_hospital_returns_empty_without_waiting() throws Exception {
        var gw = client("amb");

        long t0 = System.nanoTime();
        assertTrue(gw.queryResources("nowhere", Duration.ofSeconds(5)).isEmpty());
        assertTrue(Duration.ofNanos(System.nanoTime() - t0).compareTo(Duration.ofSeconds(1)) < 0);
    }

    // ========== t2: 응답 없는 병원 → 타임아웃 ==========
    @Test
    void t2_silent_hospital_times_out() throws Exception {
        registry.register("silent");
        var gw = client("amb");

        long t0 = System.nanoTime();
        var reply = gw.requestAdmission("silent", new PatientRequest("amb-P1", 2, "east", PatientType.EMERGENCY),
                Duration.ofMillis(200));

        assertTrue(reply.isEmpty());
        assertTrue(Duration.ofNanos(System.nanoTime() - t0).compareTo(Duration.ofMillis(190)) >= 0);
    }

    // ========== t3: 타임아웃 이후 도착한 응답은 다음 교환에서 버려진다 ==========
    @Test
    void t3_late_reply_is_dropped() throws Exception {
        Mailbox hBox = registry.register("h");
        var gw = client("amb");

        assertTrue(gw.queryResources("h", Duration.ofMillis(100)).isEmpty());
        Envelope first = hBox.receive(Duration.ZERO);
        assertNotNull(first);
        registry.deliver(first.reply(Envelope.RESOURCE_RESPONSE, null,
                "beds:0/5|staff:0/8|supplies:0/15|occupancy:1.00"));

        executor.submit(() -> {
            Envelope req = hBox.receive(Duration.ofSeconds(2));
            registry.deliver(req.reply(Envelope.RESOURCE_RESPONSE, null,
                    "beds:4/5|staff:8/8|supplies:15/15|occupancy:0.20"));
            return null;
        });

        var snap = gw.queryResources("h", Duration.ofSeconds(2)).orElseThrow();
        assertEquals(4, snap.bedsAvailable());
        assertEquals(0.2, snap.occupancy());
    }

    // ========== t4: 해석 불가 응답 → INVALID_REPLY ==========
    @Test
    void t4_garbled_outcome_is_invalid_reply() throws Exception {
        Mailbox hBox = registry.register("h");
        var gw = client("amb");

        executor.submit(() -> {
            Envelope req = hBox.receive(Duration.ofSeconds(2));
            registry.deliver(req.reply(Envelope.ADMISSION_RESPONSE, null, "???"));
            return null;
        });

        var outcome = gw.requestAdmission("h", new PatientRequest("amb-P1", 3, "x", PatientType.ROUTINE),
                Duration.ofSeconds(2)).orElseThrow();
        assertFalse(outcome.accepted());
        assertEquals(RejectReason.INVALID_REPLY, outcome.reason());
    }

    @Test
    void conversation_ids_are_owner_scoped_and_increasing() throws Exception {
        Mailbox hBox = registry.register("h");
        var gw = client("amb");

        gw.queryResources("h", Duration.ofMillis(20));
        gw.queryResources("h", Duration.ofMillis(20));

        assertEquals("amb#1", hBox.receive(Duration.ZERO).conversationId());
        assertEquals("amb#2", hBox.receive(Duration.ZERO).conversationId());
    }
}

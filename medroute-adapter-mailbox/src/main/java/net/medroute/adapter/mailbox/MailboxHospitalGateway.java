package net.medroute.adapter.mailbox;

import net.medroute.adapter.mailbox.codec.MessageCodec;
import net.medroute.core.model.AdmissionOutcome;
import net.medroute.core.model.PatientRequest;
import net.medroute.core.model.ResourceSnapshot;
import net.medroute.core.spi.HospitalGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 수신함 기반 요청/응답. 요청마다 conversationId 를 붙이고
 * 타임아웃 뒤에 늦게 도착한 응답은 버린다. 소유 액터 한 스레드에서만 사용.
 */
public final class MailboxHospitalGateway implements HospitalGateway {
    private static final Logger log = LoggerFactory.getLogger(MailboxHospitalGateway.class);

    private final Mailbox inbox;
    private final MailboxRegistry registry;
    private final AtomicLong conversations = new AtomicLong();

    public MailboxHospitalGateway(Mailbox inbox, MailboxRegistry registry) {
        this.inbox = inbox;
        this.registry = registry;
    }

    @Override
    public Optional<ResourceSnapshot> queryResources(String hospital, Duration timeout) throws InterruptedException {
        Envelope reply = exchange(hospital, Envelope.RESOURCE_QUERY, MessageCodec.QUERY_BODY, timeout);
        if (reply == null) return Optional.empty();
        var parsed = MessageCodec.parseSnapshot(reply.body());
        if (parsed.isEmpty()) log.warn("[{}] unparseable resource reply from {}: {}", owner(), hospital, reply.body());
        return parsed;
    }

    @Override
    public Optional<AdmissionOutcome> requestAdmission(String hospital, PatientRequest request, Duration timeout) throws InterruptedException {
        Envelope reply = exchange(hospital, Envelope.ADMISSION_REQUEST, MessageCodec.formatRequest(request), timeout);
        return reply == null ? Optional.empty() : Optional.of(MessageCodec.parseOutcome(reply.body(), reply.status()));
    }

    @Override
    public Optional<AdmissionOutcome> requestTransfer(String hospital, PatientRequest request, Duration timeout) throws InterruptedException {
        Envelope reply = exchange(hospital, Envelope.PATIENT_TRANSFER, MessageCodec.formatRequest(request), timeout);
        return reply == null ? Optional.empty() : Optional.of(MessageCodec.parseOutcome(reply.body(), reply.status()));
    }

    /** null = 타임아웃 또는 전달 불가 */
    private Envelope exchange(String hospital, String type, String body, Duration timeout) throws InterruptedException {
        String conversationId = owner() + "#" + conversations.incrementAndGet();
        if (!registry.deliver(Envelope.request(owner(), hospital, conversationId, type, body))) {
            return null;
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) return null;

            Envelope e = inbox.receive(Duration.ofNanos(remaining));
            if (e == null) return null;
            if (conversationId.equals(e.conversationId())) return e;
            log.warn("[{}] dropping late reply {} from {}", owner(), e.conversationId(), e.sender());
        }
    }

    public String owner() { return inbox.address(); }
}

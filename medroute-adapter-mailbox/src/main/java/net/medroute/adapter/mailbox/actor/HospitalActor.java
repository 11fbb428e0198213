package net.medroute.adapter.mailbox.actor;

import net.medroute.adapter.mailbox.Envelope;
import net.medroute.adapter.mailbox.Mailbox;
import net.medroute.adapter.mailbox.MailboxRegistry;
import net.medroute.adapter.mailbox.codec.MessageCodec;
import net.medroute.core.maintenance.DischargeSweepService;
import net.medroute.core.model.AdmissionOutcome;
import net.medroute.core.service.AdmissionLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 병원 액터. 수신함을 블로킹 대기하며 메시지 종류별로 처리하고,
 * 같은 스레드에서 주기적으로 퇴원 스윕을 돌린다(입원과 퇴원이 서로 끼어들지 않음).
 */
public final class HospitalActor implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(HospitalActor.class);

    private final Mailbox inbox;
    private final MailboxRegistry registry;
    private final AdmissionLedger ledger;
    private final DischargeSweepService sweeper;
    private volatile boolean running = true;

    public HospitalActor(Mailbox inbox, MailboxRegistry registry, AdmissionLedger ledger, DischargeSweepService sweeper) {
        this.inbox = inbox;
        this.registry = registry;
        this.ledger = ledger;
        this.sweeper = sweeper;
    }

    @Override
    public void run() {
        var s = ledger.resourceSnapshot();
        log.info("[{}] started: beds {}, staff {}, supplies {}", name(), s.bedsTotal(), s.staffTotal(), s.suppliesTotal());
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                Envelope msg = inbox.receive(sweeper.untilNext());
                if (msg != null) handle(msg);

                var report = sweeper.runIfDue();
                if (report != null && report.discharged > 0) {
                    log.debug("[{}] sweep {}", name(), report);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            log.info("[{}] stopped", name());
        }
    }

    /** 대기 중이면 STOP 메시지로 깨운다 */
    public void stop() {
        running = false;
        registry.deliver(new Envelope(name(), name(), null, Map.of(Envelope.TYPE, Envelope.STOP), ""));
    }

    void handle(Envelope msg) {
        String type = msg.type();
        try {
            if (Envelope.STOP.equals(type)) {
                return;
            }
            if (Envelope.RESOURCE_QUERY.equals(type)
                    || (type == null && MessageCodec.QUERY_BODY.equals(msg.body() == null ? null : msg.body().trim()))) {
                onResourceQuery(msg);
            } else if (Envelope.PATIENT_TRANSFER.equals(type)) {
                onTransfer(msg);
            } else {
                // 타입이 없거나 admission_request 면 입원 요청
                onAdmission(msg);
            }
        } catch (RuntimeException e) {
            log.error("[{}] failed to handle '{}' from {}", name(), type, msg.sender(), e);
        }
    }

    private void onResourceQuery(Envelope msg) {
        String body = MessageCodec.formatSnapshot(ledger.resourceSnapshot());
        registry.deliver(msg.reply(Envelope.RESOURCE_RESPONSE, null, body));
    }

    private void onAdmission(Envelope msg) {
        var request = MessageCodec.parseRequest(msg.body());
        log.debug("[{}] admission request {} from {}", name(), request, msg.sender());
        AdmissionOutcome outcome = ledger.admit(request);
        registry.deliver(msg.reply(Envelope.ADMISSION_RESPONSE, status(outcome), MessageCodec.formatOutcome(outcome)));
    }

    private void onTransfer(Envelope msg) {
        var request = MessageCodec.parseRequest(msg.body());
        log.debug("[{}] transfer request {} from {}", name(), request, msg.sender());
        AdmissionOutcome outcome = ledger.handleTransfer(request);
        registry.deliver(msg.reply(Envelope.TRANSFER_RESPONSE, status(outcome), MessageCodec.formatOutcome(outcome)));
    }

    private static String status(AdmissionOutcome o) {
        return o.accepted() ? Envelope.ACCEPTED : Envelope.REJECTED;
    }

    public String name() { return inbox.address(); }

    public AdmissionLedger ledger() { return ledger; }
}

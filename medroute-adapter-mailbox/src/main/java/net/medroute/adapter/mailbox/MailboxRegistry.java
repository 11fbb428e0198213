package net.medroute.adapter.mailbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** 주소 → 수신함. 프로세스 내부 전송 계층 */
public final class MailboxRegistry {
    private static final Logger log = LoggerFactory.getLogger(MailboxRegistry.class);

    private final Map<String, Mailbox> boxes = new ConcurrentHashMap<>();

    public Mailbox register(String address) {
        var box = new Mailbox(address);
        if (boxes.putIfAbsent(address, box) != null) {
            throw new IllegalStateException("address already registered: " + address);
        }
        return box;
    }

    public void unregister(String address) {
        boxes.remove(address);
    }

    /** 받는 쪽이 없으면 버린다(false). 요청자는 타임아웃으로 처리 */
    public boolean deliver(Envelope e) {
        var box = boxes.get(e.receiver());
        if (box == null) {
            log.warn("undeliverable message to '{}' from '{}' (type={})", e.receiver(), e.sender(), e.type());
            return false;
        }
        box.offer(e);
        return true;
    }

    public boolean isRegistered(String address) {
        return boxes.containsKey(address);
    }
}

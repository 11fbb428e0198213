package net.medroute.adapter.mailbox;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/** 액터 하나의 수신함 (무제한 FIFO) */
public final class Mailbox {
    private final String address;
    private final BlockingQueue<Envelope> queue = new LinkedBlockingQueue<>();

    public Mailbox(String address) {
        this.address = address;
    }

    public String address() { return address; }

    void offer(Envelope e) {
        queue.offer(e);
    }

    /** timeout 동안 대기, 없으면 null */
    public Envelope receive(Duration timeout) throws InterruptedException {
        long ms = Math.max(0, timeout.toMillis());
        return queue.poll(ms, TimeUnit.MILLISECONDS);
    }

    public int pending() { return queue.size(); }
}

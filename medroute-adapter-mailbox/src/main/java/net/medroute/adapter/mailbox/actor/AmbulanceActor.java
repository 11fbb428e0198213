package net.medroute.adapter.mailbox.actor;

import net.medroute.adapter.mailbox.MailboxRegistry;
import net.medroute.core.service.DispatchScheduler;
import net.medroute.core.service.DispatchStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/** 앰뷸런스 액터: 디스패치 루프를 한 번 돌리고 종료를 알린다 */
public final class AmbulanceActor implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(AmbulanceActor.class);

    private final DispatchScheduler scheduler;
    private final MailboxRegistry registry;
    private final CompletableFuture<DispatchStats> completion = new CompletableFuture<>();

    public AmbulanceActor(DispatchScheduler scheduler, MailboxRegistry registry) {
        this.scheduler = scheduler;
        this.registry = registry;
    }

    @Override
    public void run() {
        try {
            completion.complete(scheduler.run());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] interrupted before finishing", name());
            completion.complete(scheduler.stats());
        } catch (RuntimeException e) {
            log.error("[{}] dispatch loop failed", name(), e);
            completion.completeExceptionally(e);
        } finally {
            registry.unregister(name());
            log.info("[{}] finished work and shut down", name());
        }
    }

    public CompletableFuture<DispatchStats> completion() { return completion; }

    public DispatchStats stats() { return scheduler.stats(); }

    public String name() { return scheduler.ambulanceName(); }
}

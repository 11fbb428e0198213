package net.medroute.adapter.mailbox;

import net.medroute.adapter.mailbox.actor.AmbulanceActor;
import net.medroute.adapter.mailbox.actor.HospitalActor;
import net.medroute.core.config.SimulationSettings;
import net.medroute.core.maintenance.DischargeSweepService;
import net.medroute.core.report.HospitalSummary;
import net.medroute.core.report.NetworkReport;
import net.medroute.core.service.*;
import net.medroute.core.spi.Clock;
import net.medroute.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 병원/앰뷸런스 액터 묶음의 런타임. 액터 하나당 스레드 하나.
 * start → awaitCompletion → report → close
 */
public final class HospitalNetwork implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HospitalNetwork.class);

    private final MailboxRegistry registry;
    private final List<HospitalActor> hospitals;
    private final List<AmbulanceActor> ambulances;
    private ExecutorService executor;
    private volatile boolean running;
    private boolean closed;

    private HospitalNetwork(MailboxRegistry registry, List<HospitalActor> hospitals, List<AmbulanceActor> ambulances) {
        this.registry = registry;
        this.hospitals = List.copyOf(hospitals);
        this.ambulances = List.copyOf(ambulances);
    }

    public static Builder builder(SimulationSettings settings, MailboxRegistry registry, Clock clock, Sleeper sleeper) {
        return new Builder(settings, registry, clock, sleeper);
    }

    /** 병원 먼저, 그 다음 앰뷸런스 */
    public synchronized void start() {
        if (executor != null || closed) throw new IllegalStateException("network already started");
        var threads = new AtomicInteger();
        executor = Executors.newFixedThreadPool(Math.max(1, hospitals.size() + ambulances.size()), r -> {
            Thread t = new Thread(r, "medroute-actor-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        hospitals.forEach(executor::submit);
        ambulances.forEach(executor::submit);
        running = true;
        log.info("network started: hospitals={} ambulances={}", hospitalNames(), ambulanceNames());
    }

    /** 모든 앰뷸런스 종료 대기. 시간 내 끝나면 true */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        var all = CompletableFuture.allOf(ambulances.stream()
                .map(AmbulanceActor::completion)
                .toArray(CompletableFuture[]::new));
        try {
            all.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("ambulances still running after {}", timeout);
            return false;
        } catch (ExecutionException e) {
            log.error("an ambulance failed", e.getCause());
            return true;
        }
    }

    /** start 이후 close 전까지 */
    public boolean isRunning() {
        return running;
    }

    public boolean isFinished() {
        return ambulances.stream().allMatch(a -> a.completion().isDone());
    }

    public NetworkReport report() {
        List<HospitalSummary> hs = hospitals.stream().map(h -> HospitalSummary.of(h.ledger())).toList();
        List<DispatchStats> as = ambulances.stream().map(AmbulanceActor::stats).toList();
        return new NetworkReport(hs, as);
    }

    public AdmissionLedger ledger(String hospital) {
        return hospitals.stream().filter(h -> h.name().equals(hospital)).findFirst()
                .map(HospitalActor::ledger)
                .orElseThrow(() -> new NoSuchElementException("unknown hospital: " + hospital));
    }

    public List<String> hospitalNames() {
        return hospitals.stream().map(HospitalActor::name).toList();
    }

    public List<String> ambulanceNames() {
        return ambulances.stream().map(AmbulanceActor::name).toList();
    }

    public MailboxRegistry registry() { return registry; }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        running = false;
        hospitals.forEach(HospitalActor::stop);
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) executor.shutdownNow();
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        hospitals.forEach(h -> registry.unregister(h.name()));
        log.info("network stopped");
    }

    public static final class Builder {
        private final SimulationSettings settings;
        private final MailboxRegistry registry;
        private final Clock clock;
        private final Sleeper sleeper;
        private final Map<String, int[]> hospitalDefs = new LinkedHashMap<>();
        private final Map<String, Long> ambulanceDefs = new LinkedHashMap<>();

        private Builder(SimulationSettings settings, MailboxRegistry registry, Clock clock, Sleeper sleeper) {
            this.settings = Objects.requireNonNull(settings, "settings");
            this.registry = Objects.requireNonNull(registry, "registry");
            this.clock = Objects.requireNonNull(clock, "clock");
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        }

        public Builder hospital(String name, int beds, int staff, int supplies) {
            requireNewName(name);
            hospitalDefs.put(name, new int[]{beds, staff, supplies});
            return this;
        }

        /** seed 가 null 이면 비결정적 */
        public Builder ambulance(String name, Long seed) {
            requireNewName(name);
            ambulanceDefs.put(name, seed);
            return this;
        }

        private void requireNewName(String name) {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("actor name is required");
            if (hospitalDefs.containsKey(name) || ambulanceDefs.containsKey(name)) {
                throw new IllegalArgumentException("duplicate actor name: " + name);
            }
        }

        public HospitalNetwork build() {
            List<HospitalActor> hs = new ArrayList<>();
            for (var e : hospitalDefs.entrySet()) {
                int[] r = e.getValue();
                var ledger = new AdmissionLedger(e.getKey(), new ResourcePool(r[0], r[1], r[2]), settings, clock);
                var sweeper = new DischargeSweepService(ledger, clock, settings.resourceRecoveryInterval());
                hs.add(new HospitalActor(registry.register(e.getKey()), registry, ledger, sweeper));
            }

            List<String> hospitalList = List.copyOf(hospitalDefs.keySet());
            var selector = new HospitalSelector(settings);
            var retry = RetryPolicy.linear(settings.retryDelay());

            List<AmbulanceActor> as = new ArrayList<>();
            for (var e : ambulanceDefs.entrySet()) {
                String name = e.getKey();
                Long seed = e.getValue();
                Random patients = seed == null ? new Random() : new Random(seed);
                Random travel = seed == null ? new Random() : new Random(seed * 31 + 7);

                var gateway = new MailboxHospitalGateway(registry.register(name), registry);
                var scheduler = new DispatchScheduler(name, hospitalList, gateway, selector,
                        new PatientGenerator(name, settings, patients), retry, settings, clock, sleeper, travel);
                as.add(new AmbulanceActor(scheduler, registry));
            }
            return new HospitalNetwork(registry, hs, as);
        }
    }
}

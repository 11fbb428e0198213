package net.medroute.core.service;

import net.medroute.core.config.SimulationSettings;
import net.medroute.core.model.PatientRequest;
import net.medroute.core.model.PatientType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/** 앰뷸런스 한 대의 합성 환자 생성기. id 시퀀스만 상태로 가진다 */
public final class PatientGenerator {
    static final int[] EMERGENCY_SEVERITIES = {1, 1, 2, 2, 3};
    static final int[] ROUTINE_SEVERITIES = {2, 3, 3, 4, 4, 5};
    static final List<String> LOCATIONS = List.of("north", "south", "east", "west", "center");

    private final String ambulanceName;
    private final SimulationSettings settings;
    private final Random random;
    private long sequence;

    public PatientGenerator(String ambulanceName, SimulationSettings settings, Random random) {
        this.ambulanceName = Objects.requireNonNull(ambulanceName, "ambulanceName");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.random = Objects.requireNonNull(random, "random");
    }

    /** 한 틱 분량. 재시도 대기가 없을 때만 대량 사상자 이벤트 추첨 */
    public Batch next(boolean retryPending) {
        if (!retryPending && random.nextDouble() < settings.massEventProbability()) {
            return new Batch(massEvent(), true);
        }
        return new Batch(List.of(single()), false);
    }

    public PatientRequest single() {
        PatientType type = random.nextDouble() < settings.emergencyProbability()
                ? PatientType.EMERGENCY : PatientType.ROUTINE;
        return create(type);
    }

    public List<PatientRequest> massEvent() {
        int span = settings.massEventMax() - settings.massEventMin() + 1;
        int size = settings.massEventMin() + random.nextInt(span);
        List<PatientRequest> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            out.add(create(PatientType.EMERGENCY));
        }
        return out;
    }

    private PatientRequest create(PatientType type) {
        int[] pool = type == PatientType.EMERGENCY ? EMERGENCY_SEVERITIES : ROUTINE_SEVERITIES;
        int severity = pool[random.nextInt(pool.length)];
        String location = LOCATIONS.get(random.nextInt(LOCATIONS.size()));
        return new PatientRequest(nextId(), severity, location, type);
    }

    private String nextId() {
        return ambulanceName + "-P" + (++sequence);
    }

    public record Batch(List<PatientRequest> patients, boolean massEvent) {
        public Batch {
            patients = List.copyOf(patients);
        }
    }
}

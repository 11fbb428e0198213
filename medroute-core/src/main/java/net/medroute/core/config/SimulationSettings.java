package net.medroute.core.config;

import net.medroute.core.model.CareProfile;
import net.medroute.core.model.PatientType;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 액터 생성 시 주입되는 불변 시뮬레이션 설정.
 * Spring 쪽 프로퍼티는 bootstrap 모듈에서 이 레코드로 변환된다.
 */
public record SimulationSettings(
        Duration simulationDuration,
        Duration resourceRecoveryInterval,
        double emergencyProbability,
        double massEventProbability,
        int massEventMin,
        int massEventMax,
        int maxRetryAttempts,
        Duration retryDelay,
        Duration retryGracePeriod,
        Duration travelTimeMin,
        Duration travelTimeMax,
        Duration patientInterval,
        Duration queryTimeout,
        Duration admissionTimeout,
        Duration transferTimeout,
        Map<PatientType, CareProfile> profiles
) {
    public SimulationSettings {
        requirePositive(simulationDuration, "simulationDuration");
        requirePositive(resourceRecoveryInterval, "resourceRecoveryInterval");
        requireNonNegative(retryDelay, "retryDelay");
        requireNonNegative(retryGracePeriod, "retryGracePeriod");
        requireNonNegative(travelTimeMin, "travelTimeMin");
        requireNonNegative(travelTimeMax, "travelTimeMax");
        requireNonNegative(patientInterval, "patientInterval");
        requirePositive(queryTimeout, "queryTimeout");
        requirePositive(admissionTimeout, "admissionTimeout");
        requirePositive(transferTimeout, "transferTimeout");
        requireProbability(emergencyProbability, "emergencyProbability");
        requireProbability(massEventProbability, "massEventProbability");
        if (massEventMin < 1 || massEventMin > massEventMax) {
            throw new IllegalArgumentException("mass event size range invalid: " + massEventMin + ".." + massEventMax);
        }
        if (maxRetryAttempts < 0) throw new IllegalArgumentException("maxRetryAttempts must be >= 0");
        if (travelTimeMin.compareTo(travelTimeMax) > 0) {
            throw new IllegalArgumentException("travelTimeMin > travelTimeMax");
        }
        Objects.requireNonNull(profiles, "profiles");
        for (PatientType t : PatientType.values()) {
            if (!profiles.containsKey(t)) throw new IllegalArgumentException("missing care profile for " + t.code());
        }
        profiles = Map.copyOf(profiles);
    }

    public CareProfile profileFor(PatientType type) {
        return profiles.get(type);
    }

    public static SimulationSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        var b = new Builder();
        b.simulationDuration = simulationDuration;
        b.resourceRecoveryInterval = resourceRecoveryInterval;
        b.emergencyProbability = emergencyProbability;
        b.massEventProbability = massEventProbability;
        b.massEventMin = massEventMin;
        b.massEventMax = massEventMax;
        b.maxRetryAttempts = maxRetryAttempts;
        b.retryDelay = retryDelay;
        b.retryGracePeriod = retryGracePeriod;
        b.travelTimeMin = travelTimeMin;
        b.travelTimeMax = travelTimeMax;
        b.patientInterval = patientInterval;
        b.queryTimeout = queryTimeout;
        b.admissionTimeout = admissionTimeout;
        b.transferTimeout = transferTimeout;
        b.profiles = new EnumMap<>(profiles);
        return b;
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be > 0");
    }

    private static void requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) throw new IllegalArgumentException(name + " must be >= 0");
    }

    private static void requireProbability(double p, String name) {
        if (!(p >= 0.0 && p <= 1.0)) throw new IllegalArgumentException(name + " must be within [0,1]: " + p);
    }

    public static final class Builder {
        private Duration simulationDuration = Duration.ofSeconds(30);
        private Duration resourceRecoveryInterval = Duration.ofSeconds(2);
        private double emergencyProbability = 0.3;
        private double massEventProbability = 0.1;
        private int massEventMin = 3;
        private int massEventMax = 6;
        private int maxRetryAttempts = 3;
        private Duration retryDelay = Duration.ofSeconds(2);
        private Duration retryGracePeriod = Duration.ofSeconds(5);
        private Duration travelTimeMin = Duration.ofMillis(500);
        private Duration travelTimeMax = Duration.ofMillis(1500);
        private Duration patientInterval = Duration.ofMillis(500);
        private Duration queryTimeout = Duration.ofSeconds(5);
        private Duration admissionTimeout = Duration.ofSeconds(6);
        private Duration transferTimeout = Duration.ofSeconds(5);
        private Map<PatientType, CareProfile> profiles = defaultProfiles();

        private Builder() {}

        public Builder simulationDuration(Duration v) { this.simulationDuration = v; return this; }
        public Builder resourceRecoveryInterval(Duration v) { this.resourceRecoveryInterval = v; return this; }
        public Builder emergencyProbability(double v) { this.emergencyProbability = v; return this; }
        public Builder massEventProbability(double v) { this.massEventProbability = v; return this; }
        public Builder massEventSize(int min, int max) { this.massEventMin = min; this.massEventMax = max; return this; }
        public Builder maxRetryAttempts(int v) { this.maxRetryAttempts = v; return this; }
        public Builder retryDelay(Duration v) { this.retryDelay = v; return this; }
        public Builder retryGracePeriod(Duration v) { this.retryGracePeriod = v; return this; }
        public Builder travelTime(Duration min, Duration max) { this.travelTimeMin = min; this.travelTimeMax = max; return this; }
        public Builder patientInterval(Duration v) { this.patientInterval = v; return this; }
        public Builder queryTimeout(Duration v) { this.queryTimeout = v; return this; }
        public Builder admissionTimeout(Duration v) { this.admissionTimeout = v; return this; }
        public Builder transferTimeout(Duration v) { this.transferTimeout = v; return this; }
        public Builder profile(PatientType type, CareProfile profile) { this.profiles.put(type, profile); return this; }

        public SimulationSettings build() {
            return new SimulationSettings(simulationDuration, resourceRecoveryInterval,
                    emergencyProbability, massEventProbability, massEventMin, massEventMax,
                    maxRetryAttempts, retryDelay, retryGracePeriod, travelTimeMin, travelTimeMax,
                    patientInterval, queryTimeout, admissionTimeout, transferTimeout, profiles);
        }

        private static Map<PatientType, CareProfile> defaultProfiles() {
            Map<PatientType, CareProfile> m = new EnumMap<>(PatientType.class);
            m.put(PatientType.EMERGENCY, new CareProfile(2, 3, Duration.ofSeconds(12)));
            m.put(PatientType.ROUTINE, new CareProfile(1, 1, Duration.ofSeconds(6)));
            return m;
        }
    }
}

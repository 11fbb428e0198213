package net.medroute.bootstrap.props;

import net.medroute.core.config.SimulationSettings;
import net.medroute.core.model.CareProfile;
import net.medroute.core.model.PatientType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("medroute")
public class MedrouteProperties {
    private Network network = new Network();
    private Simulation simulation = new Simulation();
    private Scheduler scheduler = new Scheduler();
    private Runner runner = new Runner();

    public Network getNetwork() {
        return network;
    }

    public void setNetwork(Network network) {
        this.network = network;
    }

    public Simulation getSimulation() {
        return simulation;
    }

    public void setSimulation(Simulation simulation) {
        this.simulation = simulation;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Runner getRunner() {
        return runner;
    }

    public void setRunner(Runner runner) {
        this.runner = runner;
    }

    public static class Network {
        private List<HospitalDef> hospitals = new ArrayList<>(List.of(
                new HospitalDef("hospital1", 5, 8, 15),   // 대형
                new HospitalDef("hospital2", 3, 5, 10),   // 중형
                new HospitalDef("hospital3", 2, 3, 8)));  // 소형
        private List<AmbulanceDef> ambulances = new ArrayList<>(List.of(
                new AmbulanceDef("ambulance1", null),
                new AmbulanceDef("ambulance2", null)));

        public List<HospitalDef> getHospitals() {
            return hospitals;
        }

        public void setHospitals(List<HospitalDef> hospitals) {
            this.hospitals = hospitals;
        }

        public List<AmbulanceDef> getAmbulances() {
            return ambulances;
        }

        public void setAmbulances(List<AmbulanceDef> ambulances) {
            this.ambulances = ambulances;
        }
    }

    public static class HospitalDef {
        private String name;
        private int beds;
        private int staff;
        private int supplies;

        public HospitalDef() {
        }

        public HospitalDef(String name, int beds, int staff, int supplies) {
            this.name = name;
            this.beds = beds;
            this.staff = staff;
            this.supplies = supplies;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getBeds() {
            return beds;
        }

        public void setBeds(int beds) {
            this.beds = beds;
        }

        public int getStaff() {
            return staff;
        }

        public void setStaff(int staff) {
            this.staff = staff;
        }

        public int getSupplies() {
            return supplies;
        }

        public void setSupplies(int supplies) {
            this.supplies = supplies;
        }

        @Override
        public String toString() {
            return "HospitalDef{" +
                    "name='" + name + '\'' +
                    ", beds=" + beds +
                    ", staff=" + staff +
                    ", supplies=" + supplies +
                    '}';
        }
    }

    public static class AmbulanceDef {
        private String name;
        private Long seed;   // null = 비결정적

        public AmbulanceDef() {
        }

        public AmbulanceDef(String name, Long seed) {
            this.name = name;
            this.seed = seed;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public Long getSeed() {
            return seed;
        }

        public void setSeed(Long seed) {
            this.seed = seed;
        }

        @Override
        public String toString() {
            return "AmbulanceDef{" +
                    "name='" + name + '\'' +
                    ", seed=" + seed +
                    '}';
        }
    }

    public static class Simulation {
        private Duration duration = Duration.ofSeconds(30);
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
        private Map<String, ProfileDef> profiles = new LinkedHashMap<>(Map.of(
                "emergency", new ProfileDef(2, 3, Duration.ofSeconds(12)),
                "routine", new ProfileDef(1, 1, Duration.ofSeconds(6))));

        /** 코어가 받는 불변 설정으로 변환. 잘못된 값은 여기서 IllegalArgumentException */
        public SimulationSettings toSettings() {
            var b = SimulationSettings.builder()
                    .simulationDuration(duration)
                    .resourceRecoveryInterval(resourceRecoveryInterval)
                    .emergencyProbability(emergencyProbability)
                    .massEventProbability(massEventProbability)
                    .massEventSize(massEventMin, massEventMax)
                    .maxRetryAttempts(maxRetryAttempts)
                    .retryDelay(retryDelay)
                    .retryGracePeriod(retryGracePeriod)
                    .travelTime(travelTimeMin, travelTimeMax)
                    .patientInterval(patientInterval)
                    .queryTimeout(queryTimeout)
                    .admissionTimeout(admissionTimeout)
                    .transferTimeout(transferTimeout);
            for (var e : profiles.entrySet()) {
                PatientType type = PatientType.from(e.getKey());
                if (type == null) throw new IllegalArgumentException("unknown patient type in profiles: " + e.getKey());
                var p = e.getValue();
                b.profile(type, new CareProfile(p.getStaff(), p.getSupplies(), p.getLengthOfStay()));
            }
            return b.build();
        }

        public Duration getDuration() {
            return duration;
        }

        public void setDuration(Duration duration) {
            this.duration = duration;
        }

        public Duration getResourceRecoveryInterval() {
            return resourceRecoveryInterval;
        }

        public void setResourceRecoveryInterval(Duration resourceRecoveryInterval) {
            this.resourceRecoveryInterval = resourceRecoveryInterval;
        }

        public double getEmergencyProbability() {
            return emergencyProbability;
        }

        public void setEmergencyProbability(double emergencyProbability) {
            this.emergencyProbability = emergencyProbability;
        }

        public double getMassEventProbability() {
            return massEventProbability;
        }

        public void setMassEventProbability(double massEventProbability) {
            this.massEventProbability = massEventProbability;
        }

        public int getMassEventMin() {
            return massEventMin;
        }

        public void setMassEventMin(int massEventMin) {
            this.massEventMin = massEventMin;
        }

        public int getMassEventMax() {
            return massEventMax;
        }

        public void setMassEventMax(int massEventMax) {
            this.massEventMax = massEventMax;
        }

        public int getMaxRetryAttempts() {
            return maxRetryAttempts;
        }

        public void setMaxRetryAttempts(int maxRetryAttempts) {
            this.maxRetryAttempts = maxRetryAttempts;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public Duration getRetryGracePeriod() {
            return retryGracePeriod;
        }

        public void setRetryGracePeriod(Duration retryGracePeriod) {
            this.retryGracePeriod = retryGracePeriod;
        }

        public Duration getTravelTimeMin() {
            return travelTimeMin;
        }

        public void setTravelTimeMin(Duration travelTimeMin) {
            this.travelTimeMin = travelTimeMin;
        }

        public Duration getTravelTimeMax() {
            return travelTimeMax;
        }

        public void setTravelTimeMax(Duration travelTimeMax) {
            this.travelTimeMax = travelTimeMax;
        }

        public Duration getPatientInterval() {
            return patientInterval;
        }

        public void setPatientInterval(Duration patientInterval) {
            this.patientInterval = patientInterval;
        }

        public Duration getQueryTimeout() {
            return queryTimeout;
        }

        public void setQueryTimeout(Duration queryTimeout) {
            this.queryTimeout = queryTimeout;
        }

        public Duration getAdmissionTimeout() {
            return admissionTimeout;
        }

        public void setAdmissionTimeout(Duration admissionTimeout) {
            this.admissionTimeout = admissionTimeout;
        }

        public Duration getTransferTimeout() {
            return transferTimeout;
        }

        public void setTransferTimeout(Duration transferTimeout) {
            this.transferTimeout = transferTimeout;
        }

        public Map<String, ProfileDef> getProfiles() {
            return profiles;
        }

        public void setProfiles(Map<String, ProfileDef> profiles) {
            this.profiles = profiles;
        }
    }

    public static class ProfileDef {
        private int staff;
        private int supplies;
        private Duration lengthOfStay;

        public ProfileDef() {
        }

        public ProfileDef(int staff, int supplies, Duration lengthOfStay) {
            this.staff = staff;
            this.supplies = supplies;
            this.lengthOfStay = lengthOfStay;
        }

        public int getStaff() {
            return staff;
        }

        public void setStaff(int staff) {
            this.staff = staff;
        }

        public int getSupplies() {
            return supplies;
        }

        public void setSupplies(int supplies) {
            this.supplies = supplies;
        }

        public Duration getLengthOfStay() {
            return lengthOfStay;
        }

        public void setLengthOfStay(Duration lengthOfStay) {
            this.lengthOfStay = lengthOfStay;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long monitorDelayMs = 5000;
        private Duration queryTimeout = Duration.ofSeconds(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getMonitorDelayMs() {
            return monitorDelayMs;
        }

        public void setMonitorDelayMs(long monitorDelayMs) {
            this.monitorDelayMs = monitorDelayMs;
        }

        public Duration getQueryTimeout() {
            return queryTimeout;
        }

        public void setQueryTimeout(Duration queryTimeout) {
            this.queryTimeout = queryTimeout;
        }
    }

    public static class Runner {
        private boolean enabled = true;
        private Duration awaitTimeout = Duration.ofMinutes(2);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getAwaitTimeout() {
            return awaitTimeout;
        }

        public void setAwaitTimeout(Duration awaitTimeout) {
            this.awaitTimeout = awaitTimeout;
        }
    }
}

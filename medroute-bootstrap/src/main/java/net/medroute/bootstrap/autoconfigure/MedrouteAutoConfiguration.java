package net.medroute.bootstrap.autoconfigure;

import net.medroute.adapter.mailbox.HospitalNetwork;
import net.medroute.adapter.mailbox.MailboxRegistry;
import net.medroute.bootstrap.catalog.NetworkRegistrar;
import net.medroute.bootstrap.props.MedrouteProperties;
import net.medroute.bootstrap.runner.SimulationRunner;
import net.medroute.core.config.SimulationSettings;
import net.medroute.core.spi.Clock;
import net.medroute.core.spi.Sleeper;
import net.medroute.integration.spring.MedrouteSpringConfig;
import net.medroute.integration.spring.sched.MedrouteSchedulers;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

@AutoConfiguration
@EnableConfigurationProperties(MedrouteProperties.class)
@Import(MedrouteSpringConfig.class) // integration-spring: registry/clock/sleeper wiring
public class MedrouteAutoConfiguration {

    // --- 설정 변환 ---

    @Bean
    @ConditionalOnMissingBean
    public SimulationSettings simulationSettings(MedrouteProperties props) {
        return props.getSimulation().toSettings();
    }

    // --- 네트워크 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public NetworkRegistrar networkRegistrar(MailboxRegistry registry,
                                             SimulationSettings settings,
                                             Clock clock,
                                             Sleeper sleeper) {
        return new NetworkRegistrar(registry, settings, clock, sleeper);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public HospitalNetwork hospitalNetwork(NetworkRegistrar registrar, MedrouteProperties props) {
        return registrar.register(props.getNetwork());
    }

    // --- 모니터 스케줄러 (프로퍼티로 주기 제어) ---

    @Bean
    @ConditionalOnProperty(prefix = "medroute.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public MedrouteSchedulers medrouteSchedulers(HospitalNetwork network,
                                                 MailboxRegistry registry,
                                                 MedrouteProperties props) {
        var s = new MedrouteSchedulers(network, registry);
        // @Scheduled 주기는 medroute.scheduler.monitor-delay-ms 에서 읽힘
        s.setQueryTimeout(props.getScheduler().getQueryTimeout());
        return s;
    }

    @Bean
    @ConditionalOnProperty(prefix = "medroute.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SimulationRunner simulationRunner(HospitalNetwork network, MedrouteProperties props) {
        return new SimulationRunner(network, props.getRunner().getAwaitTimeout());
    }
}

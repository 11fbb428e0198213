package net.medroute.integration.spring;

import net.medroute.adapter.mailbox.MailboxRegistry;
import net.medroute.core.spi.Clock;
import net.medroute.core.spi.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Instant;

@Configuration
public class MedrouteSpringConfig {

    // 프로세스 내부 전송 계층 (액터 주소록)
    @Bean
    public MailboxRegistry mailboxRegistry() {
        return new MailboxRegistry();
    }

    // 기본 Clock / Sleeper. 테스트나 앱에서 같은 타입 빈으로 교체 가능
    @Bean public Clock systemClock() { return Instant::now; }

    @Bean public Sleeper systemSleeper() { return Sleeper.system(); }
}

package net.medroute.integration.spring;

import net.medroute.adapter.mailbox.MailboxRegistry;
import net.medroute.core.spi.Clock;
import net.medroute.core.spi.Sleeper;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class MedrouteSpringConfigTest {

    @Test
    void config_exposes_registry_clock_and_sleeper() {
        try (var ctx = new AnnotationConfigApplicationContext(MedrouteSpringConfig.class)) {
            assertThat(ctx.getBean(MailboxRegistry.class)).isNotNull();
            assertThat(ctx.getBean(Sleeper.class)).isNotNull();

            Instant before = Instant.now();
            assertThat(ctx.getBean(Clock.class).now()).isAfterOrEqualTo(before);
        }
    }
}

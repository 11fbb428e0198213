package net.medroute.core.spi;

import java.time.Duration;

/** 이동 시간/주기 대기. 테스트에선 가짜 시계를 전진시키는 구현을 주입 */
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    static Sleeper system() {
        return d -> {
            if (!d.isZero() && !d.isNegative()) Thread.sleep(d.toMillis());
        };
    }
}

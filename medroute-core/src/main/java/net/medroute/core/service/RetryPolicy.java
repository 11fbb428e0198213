package net.medroute.core.service;

import java.time.Duration;

public interface RetryPolicy {
    /** retries = 이번에 예약하는 재시도 회차(1부터) */
    Duration nextBackoff(int retries);

    /** 선형 백오프: delay * retries */
    static RetryPolicy linear(Duration delay) {
        return retries -> delay.multipliedBy(Math.max(1, retries));
    }
}

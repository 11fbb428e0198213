package net.medroute.core.spi;

import java.time.Instant;

public interface Clock {
    Instant now();
}

package com.image.optimization.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Clock handed to workers and the tracker. If the configured clock throws, the
 * system UTC clock answers instead so the item still gets its timestamp.
 */
final class FallbackClock extends Clock {
    private static final Logger log = LoggerFactory.getLogger(FallbackClock.class);

    private final Clock delegate;
    private final Clock fallback = Clock.systemUTC();

    private FallbackClock(Clock delegate) {
        this.delegate = delegate;
    }

    static Clock wrap(Clock delegate) {
        return delegate instanceof FallbackClock ? delegate : new FallbackClock(delegate);
    }

    @Override
    public ZoneId getZone() {
        return delegate.getZone();
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return wrap(delegate.withZone(zone));
    }

    @Override
    public Instant instant() {
        try {
            Instant now = delegate.instant();
            if (now != null) {
                return now;
            }
            log.warn("clock.failed error=null instant");
        } catch (RuntimeException e) {
            log.warn("clock.failed error={}", e.toString());
        }
        return fallback.instant();
    }
}

package com.autonomous.gateway.service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock that moves forward one second every time it is read.
 */
final class TickingClock extends Clock {

    private Instant current;

    TickingClock(Instant start) {
        this.current = start;
    }

    @Override
    public synchronized Instant instant() {
        current = current.plusSeconds(1);
        return current;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}

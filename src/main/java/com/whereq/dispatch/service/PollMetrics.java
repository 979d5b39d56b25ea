package com.whereq.dispatch.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Micrometer meters for job waits
 */
@Component
public class PollMetrics {

    public enum Outcome {
        DONE, PAUSED, FAILED, TIMEOUT, CANCELLED, ERROR
    }

    private final Map<Outcome, Counter> outcomeCounters = new EnumMap<>(Outcome.class);
    private final Timer waitTimer;

    public PollMetrics(MeterRegistry meterRegistry) {
        for (Outcome outcome : Outcome.values()) {
            outcomeCounters.put(outcome, Counter.builder("dispatch.poll.outcome")
                .description("Number of job waits by outcome")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry));
        }
        waitTimer = Timer.builder("dispatch.poll.wait")
            .description("Time spent waiting for jobs to stop")
            .register(meterRegistry);
    }

    public void record(Outcome outcome, Duration waited) {
        outcomeCounters.get(outcome).increment();
        waitTimer.record(waited);
    }
}

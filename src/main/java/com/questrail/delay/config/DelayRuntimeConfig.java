package com.questrail.delay.config;

import com.questrail.delay.observability.DelayObservabilitySink;
import com.questrail.delay.observability.Slf4jDelayObservabilitySink;
import com.questrail.delay.time.MonotonicClock;
import com.questrail.delay.time.SystemMonotonicClock;
import com.questrail.delay.time.SystemWallClock;
import com.questrail.delay.time.WallClock;

import java.time.Duration;
import java.util.Objects;

/**
 * DelayRuntimeConfig
 * -----------------------------------------------------------------------------
 * Configuration for the timer runtime behind {@code PostponableDelays}.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>timerBackend</b> — which low-level timer arms delays.</li>
 *   <li><b>wheelTickDuration</b> — tick of the hashed wheel; delays on that
 *       backend resolve up to one tick late. Ignored by the executor backend.</li>
 *   <li><b>clock</b> — monotonic source for every deadline.</li>
 *   <li><b>wallClock</b> — timestamps for observability events only.</li>
 *   <li><b>sink</b> — observability sink shared by all delays.</li>
 *   <li><b>timerThreadName</b> — name of the timer thread the runtime starts.</li>
 * </ul>
 */
public record DelayRuntimeConfig(
        TimerBackend timerBackend,
        Duration wheelTickDuration,
        MonotonicClock clock,
        WallClock wallClock,
        DelayObservabilitySink sink,
        String timerThreadName
) {
    public DelayRuntimeConfig {
        Objects.requireNonNull(timerBackend, "timerBackend");
        Objects.requireNonNull(wheelTickDuration, "wheelTickDuration");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(timerThreadName, "timerThreadName");

        if (wheelTickDuration.isNegative() || wheelTickDuration.isZero()) {
            throw new IllegalArgumentException("wheelTickDuration must be positive");
        }
        if (timerThreadName.isBlank()) {
            throw new IllegalArgumentException("timerThreadName must not be blank");
        }
    }

    public enum TimerBackend {
        /** JDK {@code ScheduledExecutorService} with a single timer thread. */
        SCHEDULED_EXECUTOR,
        /** Netty {@code HashedWheelTimer}. */
        HASHED_WHEEL
    }

    /**
     * Executor backend, system clocks, SLF4J logging.
     */
    public static DelayRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TimerBackend timerBackend = TimerBackend.SCHEDULED_EXECUTOR;
        private Duration wheelTickDuration = Duration.ofMillis(10);
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private DelayObservabilitySink sink = new Slf4jDelayObservabilitySink();
        private String timerThreadName = "postponable-delay-timer";

        public Builder withTimerBackend(TimerBackend timerBackend) {
            this.timerBackend = timerBackend;
            return this;
        }

        public Builder withWheelTickDuration(Duration wheelTickDuration) {
            this.wheelTickDuration = wheelTickDuration;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withSink(DelayObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public Builder withTimerThreadName(String timerThreadName) {
            this.timerThreadName = timerThreadName;
            return this;
        }

        public DelayRuntimeConfig build() {
            return new DelayRuntimeConfig(timerBackend, wheelTickDuration, clock, wallClock, sink, timerThreadName);
        }
    }
}

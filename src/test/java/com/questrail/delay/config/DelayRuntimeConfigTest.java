package com.questrail.delay.config;

import com.questrail.delay.observability.NullDelayObservabilitySink;
import com.questrail.delay.observability.Slf4jDelayObservabilitySink;
import com.questrail.delay.time.SystemMonotonicClock;
import com.questrail.delay.time.SystemWallClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DelayRuntimeConfigTest {

    @Test
    void defaultsUseExecutorBackendSystemClocksAndSlf4j() {
        DelayRuntimeConfig config = DelayRuntimeConfig.defaults();

        assertEquals(DelayRuntimeConfig.TimerBackend.SCHEDULED_EXECUTOR, config.timerBackend());
        assertEquals(Duration.ofMillis(10), config.wheelTickDuration());
        assertSame(SystemMonotonicClock.INSTANCE, config.clock());
        assertSame(SystemWallClock.INSTANCE, config.wallClock());
        assertInstanceOf(Slf4jDelayObservabilitySink.class, config.sink());
        assertEquals("postponable-delay-timer", config.timerThreadName());
    }

    @Test
    void builderOverridesDefaults() {
        DelayRuntimeConfig config = DelayRuntimeConfig.builder()
                .withTimerBackend(DelayRuntimeConfig.TimerBackend.HASHED_WHEEL)
                .withWheelTickDuration(Duration.ofMillis(1))
                .withSink(NullDelayObservabilitySink.INSTANCE)
                .withTimerThreadName("wheel")
                .build();

        assertEquals(DelayRuntimeConfig.TimerBackend.HASHED_WHEEL, config.timerBackend());
        assertEquals(Duration.ofMillis(1), config.wheelTickDuration());
        assertSame(NullDelayObservabilitySink.INSTANCE, config.sink());
        assertEquals("wheel", config.timerThreadName());
    }

    @Test
    void wheelTickMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> DelayRuntimeConfig.builder().withWheelTickDuration(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> DelayRuntimeConfig.builder().withWheelTickDuration(Duration.ofMillis(-5)).build());
    }

    @Test
    void missingCollaboratorsAreRejected() {
        assertThrows(NullPointerException.class,
                () -> DelayRuntimeConfig.builder().withClock(null).build());
        assertThrows(NullPointerException.class,
                () -> DelayRuntimeConfig.builder().withSink(null).build());
        assertThrows(IllegalArgumentException.class,
                () -> DelayRuntimeConfig.builder().withTimerThreadName(" ").build());
    }
}

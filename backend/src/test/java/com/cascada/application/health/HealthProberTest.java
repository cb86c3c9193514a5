/*
 * Copyright (C) 2025 Cascada Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.cascada.application.health;

import com.cascada.application.registry.RoutingConstraints;
import com.cascada.config.CascadaProperties;
import com.cascada.domain.model.CircuitState;
import com.cascada.infrastructure.provider.ProviderErrorType;
import com.cascada.testsupport.CoreFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class HealthProberTest {
    private final CoreFixture fixture = CoreFixture.create();
    private final ThreadPoolTaskScheduler scheduler = mock(ThreadPoolTaskScheduler.class);

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void failingProviderStaysOutOfRotationUntilTrialProbeSucceeds() {
        HealthProber prober = prober(true);
        fixture.adapter("gemma").alwaysFail(ProviderErrorType.TRANSPORT);

        for (int i = 0; i < 3; i++) {
            prober.probeNow("gemma");
        }
        assertEquals(CircuitState.OPEN, fixture.health.getSnapshot("gemma").circuitState());
        assertEquals("phi3", fixture.router.selectInitial(RoutingConstraints.none()).id());

        // cool-down elapsed, but no trial yet
        fixture.clock.advance(Duration.ofSeconds(31));
        assertEquals("phi3", fixture.router.selectInitial(RoutingConstraints.none()).id());

        prober.probeNow("gemma");
        HealthRecord reopened = fixture.health.getSnapshot("gemma");
        assertEquals(CircuitState.OPEN, reopened.circuitState());
        assertEquals(2, reopened.tripCount());

        fixture.clock.advance(Duration.ofSeconds(61));
        prober.probeNow("gemma");
        assertEquals(CircuitState.OPEN, fixture.health.getSnapshot("gemma").circuitState());
        assertEquals("phi3", fixture.router.selectInitial(RoutingConstraints.none()).id());
        assertEquals(5, fixture.adapter("gemma").calls());

        fixture.adapter("gemma").alwaysReply("PONG");
        fixture.clock.advance(Duration.ofMinutes(3));
        HealthRecord recovered = prober.probeNow("gemma");

        assertEquals(CircuitState.CLOSED, recovered.circuitState());
        assertEquals("gemma", fixture.router.selectInitial(RoutingConstraints.none()).id());
    }

    @Test
    void probeSkippedWhileCircuitCoolsDown() {
        HealthProber prober = prober(true);
        fixture.adapter("qwen").alwaysFail(ProviderErrorType.TIMEOUT);
        for (int i = 0; i < 3; i++) {
            prober.probeNow("qwen");
        }

        fixture.clock.advance(Duration.ofSeconds(5));
        prober.probeNow("qwen");

        assertEquals(3, fixture.adapter("qwen").calls());
    }

    @Test
    void probesRunOnProbeExecutor() {
        HealthProber prober = prober(true);

        HealthRecord record = prober.probeNow("mistral");

        assertTrue(fixture.adapter("mistral").threadNames().get(0).startsWith("test-probe-"));
        assertEquals(fixture.clock.instant(), record.lastProbeAt());
    }

    @Test
    void judgesAreProbedToo() {
        HealthProber prober = prober(true);

        prober.probeNow("safety-judge");

        assertEquals(1, fixture.safetyJudge.calls());
    }

    @Test
    void unknownProviderIsRejected() {
        HealthProber prober = prober(true);

        assertThrows(IllegalArgumentException.class, () -> prober.probeNow("nope"));
    }

    @Test
    void startSchedulesOneJobPerBackend() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
        HealthProber prober = prober(true);

        prober.start();

        assertTrue(prober.isRunning());
        verify(scheduler, times(6)).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));

        prober.stop();

        assertFalse(prober.isRunning());
        verify(future, times(6)).cancel(false);
    }

    @Test
    void disabledProberSchedulesNothing() {
        HealthProber prober = prober(false);

        prober.start();

        assertFalse(prober.isRunning());
        verifyNoInteractions(scheduler);
    }

    private HealthProber prober(boolean enabled) {
        CascadaProperties.Probe settings = new CascadaProperties.Probe(
                enabled, Duration.ofSeconds(60), Duration.ofSeconds(10), Duration.ofSeconds(2), null);
        return new HealthProber(fixture.registry, fixture.judges, fixture.execution, fixture.health,
                settings, scheduler, fixture.clock);
    }
}

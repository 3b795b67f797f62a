package com.clipforge.test;

import com.clipforge.trigger.application.command.ProductionDispatchApplicationService;
import com.clipforge.trigger.job.ProductionSchedulerDaemon;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ProductionSchedulerDaemonTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);

    @Test
    public void shouldRunTickWithUtcNow() {
        ProductionDispatchApplicationService dispatch = mock(ProductionDispatchApplicationService.class);
        ProductionSchedulerDaemon daemon = new ProductionSchedulerDaemon(dispatch, clock, true);

        daemon.tick();

        verify(dispatch).runTick(LocalDateTime.of(2026, 3, 2, 10, 0));
    }

    @Test
    public void shouldSwallowTickFailureSoNextIntervalRetries() {
        ProductionDispatchApplicationService dispatch = mock(ProductionDispatchApplicationService.class);
        when(dispatch.runTick(any(LocalDateTime.class))).thenThrow(new IllegalStateException("store unreachable"));
        ProductionSchedulerDaemon daemon = new ProductionSchedulerDaemon(dispatch, clock, true);

        Assertions.assertDoesNotThrow(daemon::tick);
        Assertions.assertDoesNotThrow(daemon::tick);

        verify(dispatch, times(2)).runTick(any(LocalDateTime.class));
    }

    @Test
    public void shouldDoNothingWhenDisabled() {
        ProductionDispatchApplicationService dispatch = mock(ProductionDispatchApplicationService.class);
        ProductionSchedulerDaemon daemon = new ProductionSchedulerDaemon(dispatch, clock, false);

        daemon.tick();

        verify(dispatch, never()).runTick(any(LocalDateTime.class));
    }
}

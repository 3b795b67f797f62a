package com.clipforge.test;

import com.clipforge.domain.production.model.entity.ProductionJobEntity;
import com.clipforge.trigger.application.common.ProductionJobRegistry;
import com.clipforge.types.enums.PlatformEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class ProductionJobRegistryTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 10, 0);

    @Test
    public void shouldAllowOnlyOneClaimPerChannelUnderContention() throws Exception {
        ProductionJobRegistry registry = new ProductionJobRegistry();
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger claimed = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            for (int i = 0; i < threads; i++) {
                pool.execute(() -> {
                    try {
                        start.await();
                        if (registry.tryClaim(newJob(1L))) {
                            claimed.incrementAndGet();
                        }
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            Assertions.assertTrue(done.await(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        Assertions.assertEquals(1, claimed.get());
        Assertions.assertEquals(1, registry.size());
    }

    @Test
    public void shouldReleaseOnlyTheClaimingJob() {
        ProductionJobRegistry registry = new ProductionJobRegistry();
        ProductionJobEntity first = newJob(1L);
        ProductionJobEntity stale = newJob(1L);

        Assertions.assertTrue(registry.tryClaim(first));
        Assertions.assertFalse(registry.release(stale));
        Assertions.assertTrue(registry.isInFlight(1L));
        Assertions.assertTrue(registry.release(first));
        Assertions.assertFalse(registry.isInFlight(1L));
        Assertions.assertTrue(registry.tryClaim(stale));
    }

    @Test
    public void shouldCancelInFlightJob() {
        ProductionJobRegistry registry = new ProductionJobRegistry();
        ProductionJobEntity job = newJob(2L);
        registry.tryClaim(job);

        Assertions.assertTrue(registry.cancel(2L));
        Assertions.assertTrue(job.isCancelRequested());
        Assertions.assertFalse(registry.cancel(3L));
    }

    private ProductionJobEntity newJob(Long channelId) {
        return ProductionJobEntity.create(channelId, 10L, 100L, PlatformEnum.TIKTOK, NOW);
    }
}

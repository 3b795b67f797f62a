package com.clipforge.trigger.job;

import com.clipforge.trigger.application.command.ProductionDispatchApplicationService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 调度守护任务：每个周期执行一次生产 tick；失败的 tick 记录日志后等待下个周期重试。
 */
@Slf4j
@Component
public class ProductionSchedulerDaemon {

    private final ProductionDispatchApplicationService productionDispatchApplicationService;
    private final Clock clock;
    private final boolean enabled;
    private final Counter tickSuccessCounter;
    private final Counter tickErrorCounter;

    public ProductionSchedulerDaemon(ProductionDispatchApplicationService productionDispatchApplicationService,
                                     Clock clock,
                                     @Value("${clipforge.scheduler.enabled:true}") boolean enabled) {
        this.productionDispatchApplicationService = productionDispatchApplicationService;
        this.clock = clock;
        this.enabled = enabled;
        this.tickSuccessCounter = Counter.builder("clipforge.scheduler.tick.total")
                .tag("result", "success")
                .register(Metrics.globalRegistry);
        this.tickErrorCounter = Counter.builder("clipforge.scheduler.tick.total")
                .tag("result", "error")
                .register(Metrics.globalRegistry);
    }

    @Scheduled(fixedDelayString = "${clipforge.scheduler.tick-interval-ms:3600000}",
            initialDelayString = "${clipforge.scheduler.initial-delay-ms:10000}",
            scheduler = "daemonScheduler")
    public void tick() {
        if (!enabled) {
            return;
        }
        try {
            productionDispatchApplicationService.runTick(LocalDateTime.now(clock));
            tickSuccessCounter.increment();
        } catch (Exception ex) {
            tickErrorCounter.increment();
            log.error("Scheduler tick abandoned, retrying next interval. error={}", ex.getMessage(), ex);
        }
    }
}

package com.clipforge.test.support;

import com.clipforge.domain.budget.service.BudgetLedgerDomainService;
import com.clipforge.domain.production.service.CaptionDomainService;
import com.clipforge.domain.production.service.ScriptContractDomainService;
import com.clipforge.domain.production.service.ScriptSceneParser;
import com.clipforge.domain.production.service.ScriptSelectionDomainService;
import com.clipforge.domain.production.service.StoryboardDomainService;
import com.clipforge.trigger.application.command.ProductionPipelineApplicationService;
import com.clipforge.trigger.application.common.AsyncJobPoller;
import com.clipforge.trigger.application.common.ProductionJobRegistry;
import com.clipforge.trigger.application.observability.ProductionStatusStore;
import com.clipforge.types.enums.PlatformEnum;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 以内存存储与桩网关装配的生产流水线，轮询间隔为毫秒级。
 */
public class ProductionPipelineFixture implements AutoCloseable {

    public static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    public final InMemoryChannelStore store = new InMemoryChannelStore();
    public final StubProductAnalysisGateway analysisGateway = new StubProductAnalysisGateway();
    public final StubPersonaGateway personaGateway = new StubPersonaGateway();
    public final StubScriptGateway scriptGateway = new StubScriptGateway();
    public final ScriptedVideoGenerationGateway videoGateway = new ScriptedVideoGenerationGateway();
    public final StubArtifactStorageGateway storageGateway = new StubArtifactStorageGateway();
    public final RecordingPublisherGateway tiktokPublisher = new RecordingPublisherGateway(PlatformEnum.TIKTOK);
    public final ProductionJobRegistry registry = new ProductionJobRegistry();
    public final ProductionStatusStore statusStore = new ProductionStatusStore();
    public final BudgetLedgerDomainService budgetLedger = new BudgetLedgerDomainService(store);
    public final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private final ScheduledExecutorService pollScheduler = Executors.newScheduledThreadPool(2);
    private final AsyncJobPoller poller;
    private final ProductionPipelineApplicationService pipeline;

    public ProductionPipelineFixture() {
        this(5L, 2_000L);
    }

    public ProductionPipelineFixture(long pollIntervalMs, long pollBudgetMs) {
        this.poller = new AsyncJobPoller(pollScheduler, pollIntervalMs, pollBudgetMs, 3, 20L);
        this.pipeline = new ProductionPipelineApplicationService(
                store.channels(),
                store.campaigns(),
                store.products(),
                analysisGateway,
                personaGateway,
                scriptGateway,
                videoGateway,
                storageGateway,
                List.of(tiktokPublisher),
                new ScriptContractDomainService(new ScriptSceneParser()),
                new ScriptSelectionDomainService(),
                new StoryboardDomainService(),
                new CaptionDomainService(),
                budgetLedger,
                poller,
                registry,
                statusStore,
                clock,
                new BigDecimal("0.32"),
                3,
                "first",
                3,
                0L);
    }

    public ProductionPipelineApplicationService pipeline() {
        return pipeline;
    }

    @Override
    public void close() {
        pollScheduler.shutdownNow();
    }
}

package com.clipforge.test;

import com.clipforge.api.dto.ChannelStatusDTO;
import com.clipforge.domain.channel.model.entity.ChannelEntity;
import com.clipforge.domain.channel.model.entity.ProductEntity;
import com.clipforge.domain.production.model.entity.ProductionJobEntity;
import com.clipforge.test.support.ChannelFixtures;
import com.clipforge.test.support.InMemoryChannelStore;
import com.clipforge.test.support.StubProductAnalysisGateway;
import com.clipforge.trigger.application.command.ChannelAdminCommandService;
import com.clipforge.trigger.application.common.ProductionJobRegistry;
import com.clipforge.trigger.application.observability.ProductionStatusStore;
import com.clipforge.trigger.application.query.ChannelStatusQueryService;
import com.clipforge.types.enums.ChannelStatusEnum;
import com.clipforge.types.enums.PipelineStageEnum;
import com.clipforge.types.enums.PlatformEnum;
import com.clipforge.types.enums.ProductionOutcomeEnum;
import com.clipforge.types.enums.ResponseCode;
import com.clipforge.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public class ChannelAdminCommandServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 10, 0);

    private InMemoryChannelStore store;
    private ProductionJobRegistry registry;
    private ProductionStatusStore statusStore;
    private ChannelAdminCommandService adminService;
    private ChannelStatusQueryService queryService;

    @BeforeEach
    public void setUp() {
        store = new InMemoryChannelStore();
        registry = new ProductionJobRegistry();
        statusStore = new ProductionStatusStore();
        adminService = new ChannelAdminCommandService(store.channels(), store.products(), registry);
        queryService = new ChannelStatusQueryService(store.channels(), store.campaigns(), registry, statusStore);
        store.save(ChannelFixtures.activeCampaign(10L));
    }

    @Test
    public void shouldDisableChannelAndCancelInFlightJob() {
        ChannelEntity channel = store.save(ChannelFixtures.activeDailyChannel(1L, 10L, 100L));
        ProductionJobEntity job = ProductionJobEntity.create(1L, 10L, 100L, PlatformEnum.TIKTOK, NOW);
        registry.tryClaim(job);

        ChannelAdminCommandService.DisableResult result = adminService.disableChannel(1L);

        Assertions.assertEquals(ChannelStatusEnum.ACTIVE, result.previousStatus());
        Assertions.assertTrue(result.inFlightCancelled());
        Assertions.assertEquals(ChannelStatusEnum.DISABLED, channel.getStatus());
        Assertions.assertTrue(job.isCancelRequested());
    }

    @Test
    public void shouldDisableIdempotentlyWithoutInFlightJob() {
        ChannelEntity channel = ChannelFixtures.activeDailyChannel(1L, 10L, 100L);
        channel.setStatus(ChannelStatusEnum.DISABLED);
        store.save(channel);

        ChannelAdminCommandService.DisableResult result = adminService.disableChannel(1L);

        Assertions.assertEquals(ChannelStatusEnum.DISABLED, result.previousStatus());
        Assertions.assertFalse(result.inFlightCancelled());
    }

    @Test
    public void shouldRejectUnknownChannel() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> adminService.disableChannel(404L));

        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), ex.getCode());
    }

    @Test
    public void shouldClearCachedAnalysis() {
        ProductEntity product = ChannelFixtures.product(100L);
        product.setCachedAnalysis(StubProductAnalysisGateway.sampleAnalysis());
        store.save(product);

        Assertions.assertTrue(adminService.invalidateAnalysis(100L));
        Assertions.assertFalse(product.hasCachedAnalysis());
        Assertions.assertThrows(AppException.class, () -> adminService.invalidateAnalysis(999L));
    }

    @Test
    public void shouldReportCurrentStageAndLastRun() {
        ChannelEntity channel = ChannelFixtures.activeDailyChannel(1L, 10L, 100L);
        channel.setDailyProductionCost(new BigDecimal("0.32"));
        store.save(channel);
        ProductionJobEntity finished = ProductionJobEntity.create(1L, 10L, 100L, PlatformEnum.TIKTOK, NOW.minusDays(1));
        finished.fail(ProductionOutcomeEnum.TIMEOUT, "Polling exceeded budget", NOW.minusDays(1));
        statusStore.recordFinished(finished);
        ProductionJobEntity running = ProductionJobEntity.create(1L, 10L, 100L, PlatformEnum.TIKTOK, NOW);
        running.markPersonaReady();
        registry.tryClaim(running);
        statusStore.recordStarted(running);

        ChannelStatusDTO status = queryService.getStatus(1L);

        Assertions.assertTrue(status.getInFlight());
        Assertions.assertEquals(PipelineStageEnum.PERSONA_READY.getCode(), status.getCurrentStage());
        Assertions.assertEquals(running.getJobId(), status.getCurrentJobId());
        Assertions.assertEquals(NOW, status.getLastRunAt());
        Assertions.assertEquals("timeout", status.getLastOutcome());
        Assertions.assertEquals("Polling exceeded budget", status.getLastError());
        Assertions.assertEquals(0, BigDecimal.ZERO.compareTo(status.getLastCost()));
        Assertions.assertEquals(0, new BigDecimal("0.32").compareTo(status.getDailyProductionCost()));
    }

    @Test
    public void shouldListChannelsOfActiveCampaignsAndTrackedChannels() {
        store.save(ChannelFixtures.activeDailyChannel(1L, 10L, 100L));
        store.save(ChannelFixtures.activeDailyChannel(2L, 99L, 100L));
        ProductionJobEntity job = ProductionJobEntity.create(2L, 99L, 100L, PlatformEnum.TIKTOK, NOW);
        statusStore.recordStarted(job);

        List<ChannelStatusDTO> statuses = queryService.listStatuses();

        Assertions.assertEquals(2, statuses.size());
        Assertions.assertEquals(1L, statuses.get(0).getChannelId().longValue());
        Assertions.assertEquals(2L, statuses.get(1).getChannelId().longValue());
        Assertions.assertFalse(statuses.get(0).getInFlight());
    }
}

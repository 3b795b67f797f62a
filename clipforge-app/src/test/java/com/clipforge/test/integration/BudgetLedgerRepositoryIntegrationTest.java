package com.clipforge.test.integration;

import com.clipforge.Application;
import com.clipforge.domain.budget.adapter.repository.IBudgetLedgerRepository;
import com.clipforge.domain.budget.model.valobj.BudgetCommitCommand;
import com.clipforge.domain.budget.model.valobj.BudgetCommitResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

@SpringBootTest(
        classes = Application.class,
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "spring.task.scheduling.enabled=false"
        }
)
@EnabledIfSystemProperty(named = "it.docker.enabled", matches = "true")
public class BudgetLedgerRepositoryIntegrationTest extends PostgresIntegrationTestSupport {

    private static final BigDecimal JOB_COST = new BigDecimal("0.32");
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 10, 0);

    @Autowired
    private IBudgetLedgerRepository budgetLedgerRepository;

    @Test
    public void shouldAcceptExactlyAffordableCommitsUnderConcurrency() throws Exception {
        Long campaignId = insertCampaign(new BigDecimal("500.00"), BigDecimal.ZERO);
        Long channelId = insertChannel(campaignId, new BigDecimal("1.28"), BigDecimal.ZERO);

        int workers = 5;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<BudgetCommitResult>> futures = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                Callable<BudgetCommitResult> commit = () -> {
                    start.await(2, TimeUnit.SECONDS);
                    return budgetLedgerRepository.commit(command(channelId, campaignId, new BigDecimal("500.00")));
                };
                futures.add(pool.submit(commit));
            }
            start.countDown();

            int accepted = 0;
            int rejected = 0;
            for (Future<BudgetCommitResult> future : futures) {
                BudgetCommitResult result = future.get(10, TimeUnit.SECONDS);
                if (result.accepted()) {
                    accepted++;
                } else {
                    rejected++;
                    Assertions.assertEquals(BudgetCommitResult.RejectReason.CHANNEL_DAILY_LIMIT, result.rejectReason());
                }
            }
            Assertions.assertEquals(4, accepted);
            Assertions.assertEquals(1, rejected);
        } finally {
            pool.shutdownNow();
        }

        Map<String, Object> channel = jdbcTemplate.queryForMap(
                "SELECT daily_production_cost, total_production_cost, videos_produced FROM channel WHERE id = ?", channelId);
        Assertions.assertEquals(0, new BigDecimal("1.28").compareTo((BigDecimal) channel.get("daily_production_cost")));
        Assertions.assertEquals(0, new BigDecimal("1.28").compareTo((BigDecimal) channel.get("total_production_cost")));
        Assertions.assertEquals(4, ((Number) channel.get("videos_produced")).intValue());
        BigDecimal campaignSpent = jdbcTemplate.queryForObject(
                "SELECT monthly_spent FROM campaign WHERE id = ?", BigDecimal.class, campaignId);
        Assertions.assertEquals(0, new BigDecimal("1.28").compareTo(campaignSpent));
    }

    @Test
    public void shouldRollbackChannelCountersWhenCampaignCapReached() {
        Long campaignId = insertCampaign(new BigDecimal("1.00"), new BigDecimal("0.90"));
        Long channelId = insertChannel(campaignId, new BigDecimal("10.00"), BigDecimal.ZERO);

        BudgetCommitResult result = budgetLedgerRepository.commit(command(channelId, campaignId, new BigDecimal("1.00")));

        Assertions.assertFalse(result.accepted());
        Assertions.assertEquals(BudgetCommitResult.RejectReason.CAMPAIGN_MONTHLY_LIMIT, result.rejectReason());
        Map<String, Object> channel = jdbcTemplate.queryForMap(
                "SELECT daily_production_cost, last_upload_time FROM channel WHERE id = ?", channelId);
        Assertions.assertEquals(0, BigDecimal.ZERO.compareTo((BigDecimal) channel.get("daily_production_cost")));
        Assertions.assertNull(channel.get("last_upload_time"));
    }

    @Test
    public void shouldWriteLastUploadTimeAndLatestVideoOnCommit() {
        Long campaignId = insertCampaign(null, BigDecimal.ZERO);
        Long channelId = insertChannel(campaignId, BigDecimal.ZERO, BigDecimal.ZERO);

        BudgetCommitResult result = budgetLedgerRepository.commit(command(channelId, campaignId, null));

        Assertions.assertTrue(result.accepted());
        Map<String, Object> channel = jdbcTemplate.queryForMap(
                "SELECT last_upload_time, latest_video_url FROM channel WHERE id = ?", channelId);
        Assertions.assertNotNull(channel.get("last_upload_time"));
        Assertions.assertEquals("https://cdn.test/2026/03/02/job.mp4", channel.get("latest_video_url"));
    }

    @Test
    public void shouldRejectCommitForUnknownChannel() {
        BudgetCommitResult result = budgetLedgerRepository.commit(command(999L, null, null));

        Assertions.assertFalse(result.accepted());
        Assertions.assertEquals(BudgetCommitResult.RejectReason.CHANNEL_NOT_FOUND, result.rejectReason());
    }

    @Test
    public void shouldResetDailyCountersOncePerDay() {
        Long campaignId = insertCampaign(null, BigDecimal.ZERO);
        Long channelId = insertChannel(campaignId, new BigDecimal("1.00"), new BigDecimal("0.90"));
        LocalDate today = LocalDate.of(2026, 3, 2);

        Assertions.assertEquals(1, budgetLedgerRepository.resetDailyCounters(today));
        Assertions.assertEquals(0, budgetLedgerRepository.resetDailyCounters(today));

        BigDecimal dailyCost = jdbcTemplate.queryForObject(
                "SELECT daily_production_cost FROM channel WHERE id = ?", BigDecimal.class, channelId);
        Assertions.assertEquals(0, BigDecimal.ZERO.compareTo(dailyCost));
        Assertions.assertEquals(1, budgetLedgerRepository.resetDailyCounters(today.plusDays(1)));
    }

    @Test
    public void shouldResetMonthlySpendOncePerMonth() {
        Long campaignId = insertCampaign(new BigDecimal("500.00"), new BigDecimal("42.50"));

        Assertions.assertEquals(1, budgetLedgerRepository.resetMonthlySpend(YearMonth.of(2026, 3)));
        Assertions.assertEquals(0, budgetLedgerRepository.resetMonthlySpend(YearMonth.of(2026, 3)));
        BigDecimal spent = jdbcTemplate.queryForObject(
                "SELECT monthly_spent FROM campaign WHERE id = ?", BigDecimal.class, campaignId);
        Assertions.assertEquals(0, BigDecimal.ZERO.compareTo(spent));
    }

    private BudgetCommitCommand command(Long channelId, Long campaignId, BigDecimal cap) {
        return BudgetCommitCommand.builder()
                .channelId(channelId)
                .campaignId(campaignId)
                .amount(JOB_COST)
                .campaignMonthlyCap(cap)
                .artifactUrl("https://cdn.test/2026/03/02/job.mp4")
                .committedAt(NOW)
                .build();
    }
}

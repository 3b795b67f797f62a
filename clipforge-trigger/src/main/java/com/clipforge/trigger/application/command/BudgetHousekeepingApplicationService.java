package com.clipforge.trigger.application.command;

import com.clipforge.domain.budget.service.BudgetLedgerDomainService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 预算归零用例：每个 UTC 日的第一次 tick 归零渠道日计数，每月的第一次 tick 归零活动月度花费。
 * <p>
 * 重置窗口自 00:00 开启，直到当日重置生效才关闭，tick 漂移或进程重启都不会错过一天。
 * 进程内以最近重置日期去重；存储层另有 cost_reset_date / spend_reset_month 条件，
 * 多实例或重启后也不会重复归零。
 * </p>
 */
@Slf4j
@Service
public class BudgetHousekeepingApplicationService {

    private final BudgetLedgerDomainService budgetLedgerDomainService;
    private final AtomicReference<LocalDate> lastDailyReset = new AtomicReference<>();
    private final AtomicReference<YearMonth> lastMonthlyReset = new AtomicReference<>();

    public BudgetHousekeepingApplicationService(BudgetLedgerDomainService budgetLedgerDomainService) {
        this.budgetLedgerDomainService = budgetLedgerDomainService;
    }

    public HousekeepingResult runIfDue(LocalDateTime now) {
        if (now == null) {
            return HousekeepingResult.empty();
        }
        LocalDate today = now.toLocalDate();

        boolean dailyApplied = false;
        int dailyRows = 0;
        LocalDate previousDaily = lastDailyReset.get();
        if (!today.equals(previousDaily) && lastDailyReset.compareAndSet(previousDaily, today)) {
            try {
                dailyRows = budgetLedgerDomainService.resetDaily(today);
                dailyApplied = true;
            } catch (RuntimeException ex) {
                lastDailyReset.compareAndSet(today, previousDaily);
                throw ex;
            }
        }

        boolean monthlyApplied = false;
        int monthlyRows = 0;
        YearMonth month = YearMonth.from(today);
        YearMonth previousMonthly = lastMonthlyReset.get();
        if (!month.equals(previousMonthly)
                && lastMonthlyReset.compareAndSet(previousMonthly, month)) {
            try {
                monthlyRows = budgetLedgerDomainService.resetMonthly(month);
                monthlyApplied = true;
            } catch (RuntimeException ex) {
                lastMonthlyReset.compareAndSet(month, previousMonthly);
                throw ex;
            }
        }

        if (dailyApplied || monthlyApplied) {
            log.info("Budget housekeeping applied. date={}, dailyApplied={}, dailyRows={}, monthlyApplied={}, monthlyRows={}",
                    today, dailyApplied, dailyRows, monthlyApplied, monthlyRows);
        }
        return new HousekeepingResult(dailyApplied, dailyRows, monthlyApplied, monthlyRows);
    }

    public record HousekeepingResult(boolean dailyResetApplied,
                                     int dailyRows,
                                     boolean monthlyResetApplied,
                                     int monthlyRows) {

        public static HousekeepingResult empty() {
            return new HousekeepingResult(false, 0, false, 0);
        }
    }
}

package com.clipforge.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 手动触发一次调度的结果 DTO。
 */
@Data
public class SchedulerTickResponseDTO {

    private LocalDateTime tickTime;
    private Boolean dailyResetApplied;
    private Boolean monthlyResetApplied;
    private Integer campaignCount;
    private Integer campaignOverBudgetCount;
    private Integer channelCount;
    private Integer dispatchedCount;
    private Integer notDueCount;
    private Integer budgetSkippedCount;
    private Integer inFlightSkippedCount;
    private Integer misconfiguredCount;
    private Integer rejectedCount;
    private Integer errorCount;
    private Integer cancelledCount;
}

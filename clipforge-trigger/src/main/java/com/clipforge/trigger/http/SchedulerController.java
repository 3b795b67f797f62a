package com.clipforge.trigger.http;

import com.clipforge.api.dto.SchedulerTickResponseDTO;
import com.clipforge.api.response.Response;
import com.clipforge.trigger.application.command.ProductionDispatchApplicationService;
import com.clipforge.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 调度运维 API：手动执行一次 tick。
 */
@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {

    private final ProductionDispatchApplicationService productionDispatchApplicationService;
    private final Clock clock;

    public SchedulerController(ProductionDispatchApplicationService productionDispatchApplicationService, Clock clock) {
        this.productionDispatchApplicationService = productionDispatchApplicationService;
        this.clock = clock;
    }

    @PostMapping("/tick")
    public Response<SchedulerTickResponseDTO> tick() {
        ProductionDispatchApplicationService.TickResult result =
                productionDispatchApplicationService.runTick(LocalDateTime.now(clock));
        return Response.<SchedulerTickResponseDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(toDTO(result))
                .build();
    }

    private SchedulerTickResponseDTO toDTO(ProductionDispatchApplicationService.TickResult result) {
        SchedulerTickResponseDTO dto = new SchedulerTickResponseDTO();
        dto.setTickTime(result.tickTime());
        dto.setDailyResetApplied(result.dailyResetApplied());
        dto.setMonthlyResetApplied(result.monthlyResetApplied());
        dto.setCampaignCount(result.campaignCount());
        dto.setCampaignOverBudgetCount(result.campaignOverBudgetCount());
        dto.setChannelCount(result.channelCount());
        dto.setDispatchedCount(result.dispatchedCount());
        dto.setNotDueCount(result.notDueCount());
        dto.setBudgetSkippedCount(result.budgetSkippedCount());
        dto.setInFlightSkippedCount(result.inFlightSkippedCount());
        dto.setMisconfiguredCount(result.misconfiguredCount());
        dto.setRejectedCount(result.rejectedCount());
        dto.setErrorCount(result.errorCount());
        dto.setCancelledCount(result.cancelledCount());
        return dto;
    }
}

package com.clipforge.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 渠道生产状态 DTO（只读）。
 */
@Data
public class ChannelStatusDTO {

    private Long channelId;
    private String channelName;
    private String platform;
    private String channelStatus;
    private LocalDateTime lastUploadTime;
    private BigDecimal dailyProductionCost;
    private BigDecimal dailySpendLimit;
    private BigDecimal totalProductionCost;
    private String latestVideoUrl;
    private LocalDateTime lastRunAt;
    private BigDecimal lastCost;
    private String lastError;
    private String lastOutcome;
    private String currentStage;
    private String currentJobId;
    private Boolean inFlight;
}

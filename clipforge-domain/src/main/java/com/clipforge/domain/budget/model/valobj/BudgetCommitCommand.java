package com.clipforge.domain.budget.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 一次成功产出的入账指令。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetCommitCommand {

    private Long channelId;

    private Long campaignId;

    /**
     * 入账金额，必须为正
     */
    private BigDecimal amount;

    /**
     * 活动生效月度上限，null 表示不限
     */
    private BigDecimal campaignMonthlyCap;

    /**
     * 产出素材的公开地址，写入渠道 latest_video_url
     */
    private String artifactUrl;

    /**
     * 入账时间（UTC），同时作为 last_upload_time
     */
    private LocalDateTime committedAt;
}

package com.clipforge.types.common;

import java.math.BigDecimal;
import java.util.Set;

/**
 * 全局常量定义类。
 *
 * @author clipforge
 * @since 2026-03-02
 */
public class Constants {

    /** 逗号分隔符，用于字符串分割操作 */
    public final static String SPLIT = ",";

    /** 单条视频的默认生产成本（美元） */
    public final static BigDecimal DEFAULT_COST_PER_VIDEO = new BigDecimal("0.32");

    /** 活动月度预算未配置时的默认上限（美元） */
    public final static BigDecimal DEFAULT_MONTHLY_BUDGET = new BigDecimal("500.00");

    /** 分镜允许的总时长（秒） */
    public final static Set<Integer> ALLOWED_STORYBOARD_TOTALS = Set.of(10, 15, 25);

    /** 固定分镜数量 */
    public final static int STORYBOARD_SCENE_COUNT = 3;

    /** 发布凭证：访问令牌 */
    public final static String CREDENTIAL_ACCESS_TOKEN = "access_token";

    /** 发布凭证：Instagram 业务账号 ID */
    public final static String CREDENTIAL_IG_USER_ID = "ig_user_id";

    /** 日志上下文：渠道 ID */
    public final static String MDC_CHANNEL_ID = "channelId";

    /** 日志上下文：生产任务 ID */
    public final static String MDC_JOB_ID = "jobId";

}

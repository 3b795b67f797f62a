package com.clipforge.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 生产任务终态结果。
 *
 * @author clipforge
 * @since 2026-03-02
 */
public enum ProductionOutcomeEnum {

    PUBLISHED("published", true),

    /** 素材已产出，渠道无发布凭证 */
    PUBLISH_SKIPPED("publish_skipped", true),

    /** 素材已产出，平台发布失败 */
    PUBLISH_FAILED("publish_failed", true),

    FAILED("failed", false),

    /** 轮询超出墙钟预算 */
    TIMEOUT("timeout", false),

    /** 渠道停用导致任务被放弃 */
    CANCELLED("cancelled", false),

    /** 入账时预算校验未通过 */
    BUDGET_REJECTED("budget_rejected", false);

    private final String code;
    private final boolean assetProduced;

    ProductionOutcomeEnum(String code, boolean assetProduced) {
        this.code = code;
        this.assetProduced = assetProduced;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isAssetProduced() {
        return assetProduced;
    }
}

package com.clipforge.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 活动状态枚举
 *
 * @author clipforge
 * @since 2026-03-02
 */
public enum CampaignStatusEnum {

    DRAFT("draft"),

    ACTIVE("active"),

    PAUSED("paused"),

    COMPLETED("completed");

    private final String code;

    CampaignStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static CampaignStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (CampaignStatusEnum status : CampaignStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown campaign status code: " + code);
    }
}

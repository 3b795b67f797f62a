package com.clipforge.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 渠道状态枚举
 *
 * @author clipforge
 * @since 2026-03-02
 */
public enum ChannelStatusEnum {

    /**
     * 测试中 - 已配置但不参与自动生产
     */
    TESTING("testing"),

    /**
     * 运行中 - 参与调度
     */
    ACTIVE("active"),

    /**
     * 已暂停
     */
    PAUSED("paused"),

    /**
     * 已停用 - 在途任务需放弃
     */
    DISABLED("disabled");

    private final String code;

    ChannelStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ChannelStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ChannelStatusEnum status : ChannelStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown channel status code: " + code);
    }
}

package com.clipforge.types.enums;

/**
 * 候选脚本选择策略。
 */
public enum ScriptSelectionStrategyEnum {

    /**
     * 取第一个可解析的候选
     */
    FIRST("first"),

    /**
     * 取风险最少的候选，相同时取靠前者
     */
    FEWEST_RISKS("fewest-risks");

    private final String code;

    ScriptSelectionStrategyEnum(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ScriptSelectionStrategyEnum fromCode(String code) {
        if (code == null || code.isBlank()) {
            return FIRST;
        }
        for (ScriptSelectionStrategyEnum strategy : ScriptSelectionStrategyEnum.values()) {
            if (strategy.code.equalsIgnoreCase(code.trim())) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown script selection strategy: " + code);
    }
}

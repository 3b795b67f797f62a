package com.clipforge.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 生产流水线阶段枚举
 *
 * @author clipforge
 * @since 2026-03-02
 */
public enum PipelineStageEnum {

    /**
     * 待分析 - 任务已创建，尚未得到产品分析
     */
    PENDING_ANALYSIS("pending_analysis", false),

    /**
     * 人设就绪
     */
    PERSONA_READY("persona_ready", false),

    /**
     * 脚本就绪
     */
    SCRIPT_READY("script_ready", false),

    /**
     * 分镜就绪
     */
    STORYBOARD_READY("storyboard_ready", false),

    /**
     * 已提交到视频生成后端
     */
    JOB_SUBMITTED("job_submitted", false),

    /**
     * 轮询中
     */
    JOB_POLLING("job_polling", false),

    /**
     * 素材就绪 - 成本已入账；无发布凭证时即为终态
     */
    ASSET_READY("asset_ready", false),

    /**
     * 已发布
     */
    PUBLISHED("published", true),

    /**
     * 发布失败 - 素材已产出，不视为流水线失败
     */
    PUBLISH_FAILED("publish_failed", true),

    /**
     * 失败
     */
    FAILED("failed", true);

    private final String code;
    private final boolean terminal;

    PipelineStageEnum(String code, boolean terminal) {
        this.code = code;
        this.terminal = terminal;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public static PipelineStageEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (PipelineStageEnum stage : PipelineStageEnum.values()) {
            if (stage.code.equals(code)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown pipeline stage code: " + code);
    }
}

package com.clipforge.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义 API 响应码，同时作为生产链路错误分类的错误码。
 * </p>
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 资源不存在 */
    NOT_FOUND("0003", "资源不存在"),

    /** 配置缺失或非法（渠道级致命，跳过） */
    CONFIGURATION_ERROR("1001", "配置错误"),

    /** 外部服务瞬时故障（网络/DNS/5xx，可重试） */
    TRANSIENT_PROVIDER_ERROR("1002", "外部服务暂时不可用"),

    /** 生成内容违反结构约定 */
    VALIDATION_ERROR("1003", "生成内容校验失败"),

    /** 预算不足 */
    BUDGET_EXCEEDED("1004", "预算不足"),

    /** 异步任务轮询超时 */
    JOB_TIMEOUT("1005", "任务轮询超时"),

    /** 异步任务失败 */
    JOB_FAILED("1006", "任务执行失败");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}

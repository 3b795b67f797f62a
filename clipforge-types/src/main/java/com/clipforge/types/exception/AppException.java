package com.clipforge.types.exception;

import com.clipforge.types.enums.ResponseCode;
import lombok.Getter;

/**
 * 应用异常基类，携带 {@link ResponseCode} 编码。
 * <p>
 * 生产链路的错误分类（配置、瞬时故障、契约校验、预算、超时）均为其子类；
 * 只有 {@link #isRetryable()} 为 true 的异常会被有限次数重试。
 * </p>
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Getter
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 2843190715523187406L;

    private final String code;

    private final String info;

    public AppException(ResponseCode responseCode, String info) {
        this(responseCode, info, null);
    }

    public AppException(ResponseCode responseCode, String info, Throwable cause) {
        super(info, cause);
        this.code = responseCode.getCode();
        this.info = info == null ? responseCode.getInfo() : info;
    }

    public boolean isRetryable() {
        return false;
    }

    @Override
    public String getMessage() {
        return info;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{code='" + code + "', info='" + info + "'}";
    }
}

package com.clipforge.types.exception;

import com.clipforge.types.enums.ResponseCode;

/**
 * 外部服务瞬时故障（网络/DNS/5xx），调用方按有限次数退避重试。
 */
public class TransientProviderException extends AppException {

    private static final long serialVersionUID = 1L;

    public TransientProviderException(String message) {
        super(ResponseCode.TRANSIENT_PROVIDER_ERROR, message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(ResponseCode.TRANSIENT_PROVIDER_ERROR, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

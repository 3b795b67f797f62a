package com.clipforge.types.exception;

import com.clipforge.types.enums.ResponseCode;

/**
 * 异步任务超过轮询墙钟预算，终态，不计成本。
 */
public class JobTimeoutException extends AppException {

    private static final long serialVersionUID = 1L;

    public JobTimeoutException(String message) {
        super(ResponseCode.JOB_TIMEOUT, message);
    }

    public JobTimeoutException(String message, Throwable cause) {
        super(ResponseCode.JOB_TIMEOUT, message, cause);
    }
}

package com.clipforge.types.exception;

import com.clipforge.types.enums.ResponseCode;

/**
 * 生成结果违反结构约定，或外部返回的载荷无法通过边界校验。
 */
public class ContractValidationException extends AppException {

    private static final long serialVersionUID = 1L;

    public ContractValidationException(String message) {
        super(ResponseCode.VALIDATION_ERROR, message);
    }

    public ContractValidationException(String message, Throwable cause) {
        super(ResponseCode.VALIDATION_ERROR, message, cause);
    }
}

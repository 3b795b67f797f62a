package com.clipforge.types.exception;

import com.clipforge.types.enums.ResponseCode;

/**
 * 预算不足，不重试，渠道等待下一个预算周期。
 */
public class BudgetExceededException extends AppException {

    private static final long serialVersionUID = 1L;

    public BudgetExceededException(String message) {
        super(ResponseCode.BUDGET_EXCEEDED, message);
    }

    public BudgetExceededException(String message, Throwable cause) {
        super(ResponseCode.BUDGET_EXCEEDED, message, cause);
    }
}

package com.clipforge.types.exception;

import com.clipforge.types.enums.ResponseCode;

/**
 * 渠道配置缺失或非法（凭证、产品、预算配置），对该渠道致命，本轮跳过。
 */
public class ConfigurationException extends AppException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(ResponseCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ResponseCode.CONFIGURATION_ERROR, message, cause);
    }
}

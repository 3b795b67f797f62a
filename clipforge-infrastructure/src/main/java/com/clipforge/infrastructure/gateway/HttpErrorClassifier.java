package com.clipforge.infrastructure.gateway;

import com.clipforge.types.enums.ResponseCode;
import com.clipforge.types.exception.AppException;
import com.clipforge.types.exception.ConfigurationException;
import com.clipforge.types.exception.TransientProviderException;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

/**
 * 把 RestTemplate 异常映射到错误分类：网络/超时/5xx/429 为瞬时故障，401/403 为配置错误。
 */
public final class HttpErrorClassifier {

    private HttpErrorClassifier() {
    }

    public static AppException classify(String operation, RestClientException ex) {
        if (ex instanceof ResourceAccessException || ex instanceof HttpServerErrorException) {
            return new TransientProviderException(operation + " failed transiently: " + ex.getMessage(), ex);
        }
        if (ex instanceof HttpClientErrorException clientError) {
            if (clientError.getStatusCode().isSameCodeAs(HttpStatus.TOO_MANY_REQUESTS)) {
                return new TransientProviderException(operation + " rate limited", ex);
            }
            if (clientError.getStatusCode().isSameCodeAs(HttpStatus.UNAUTHORIZED)
                    || clientError.getStatusCode().isSameCodeAs(HttpStatus.FORBIDDEN)) {
                return new ConfigurationException(operation + " rejected credentials: " + clientError.getStatusCode());
            }
        }
        return new AppException(ResponseCode.JOB_FAILED, operation + " failed: " + ex.getMessage(), ex);
    }
}

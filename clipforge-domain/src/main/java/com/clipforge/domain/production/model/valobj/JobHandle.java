package com.clipforge.domain.production.model.valobj;

import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;

/**
 * 外部异步任务句柄，由单个流水线独占。
 *
 * @param externalId  后端返回的任务标识
 * @param submittedAt 提交时间（UTC）
 */
public record JobHandle(String externalId, LocalDateTime submittedAt) {

    public JobHandle {
        if (StringUtils.isBlank(externalId)) {
            throw new IllegalArgumentException("Job handle id cannot be blank");
        }
    }
}

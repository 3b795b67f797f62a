package com.clipforge.domain.production.model.valobj;

import com.clipforge.types.enums.JobPollStateEnum;

/**
 * 单次轮询结果。
 *
 * @param state     pending / success / fail
 * @param resultUrl 成功时的结果地址
 * @param error     失败原因
 */
public record JobPollResult(JobPollStateEnum state, String resultUrl, String error) {

    public static JobPollResult pending() {
        return new JobPollResult(JobPollStateEnum.PENDING, null, null);
    }

    public static JobPollResult success(String resultUrl) {
        return new JobPollResult(JobPollStateEnum.SUCCESS, resultUrl, null);
    }

    public static JobPollResult fail(String error) {
        return new JobPollResult(JobPollStateEnum.FAIL, null, error);
    }
}

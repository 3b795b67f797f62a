package com.clipforge.types.enums;

/**
 * 外部异步任务单次轮询返回的状态。
 */
public enum JobPollStateEnum {

    PENDING,

    SUCCESS,

    FAIL
}

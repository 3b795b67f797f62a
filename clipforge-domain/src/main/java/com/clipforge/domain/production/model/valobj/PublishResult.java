package com.clipforge.domain.production.model.valobj;

/**
 * 平台发布结果。
 */
public record PublishResult(boolean success, String remoteUrl, String error) {

    public static PublishResult success(String remoteUrl) {
        return new PublishResult(true, remoteUrl, null);
    }

    public static PublishResult failure(String error) {
        return new PublishResult(false, null, error);
    }
}

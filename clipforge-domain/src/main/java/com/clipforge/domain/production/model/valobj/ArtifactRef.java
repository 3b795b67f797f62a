package com.clipforge.domain.production.model.valobj;

/**
 * 已持久化的素材引用。
 *
 * @param storageKey 存储内部键
 * @param publicUrl  可公开访问的地址
 * @param sizeBytes  文件大小
 */
public record ArtifactRef(String storageKey, String publicUrl, long sizeBytes) {
}

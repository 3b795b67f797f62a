package com.clipforge.domain.production.adapter.gateway;

import com.clipforge.domain.production.model.valobj.ArtifactRef;

/**
 * 素材持久化存储：下载后端结果并返回公开引用。
 */
public interface IArtifactStorageGateway {

    ArtifactRef store(String sourceUrl, String jobId);
}

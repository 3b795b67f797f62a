package com.clipforge.domain.production.adapter.gateway;

import com.clipforge.domain.production.model.valobj.ArtifactRef;
import com.clipforge.domain.production.model.valobj.PublishResult;
import com.clipforge.types.enums.PlatformEnum;

import java.util.Map;

/**
 * 平台发布适配器，每个平台一个实现。
 * <p>
 * 发布失败通过 {@link PublishResult#failure(String)} 返回，不抛出异常。
 * </p>
 */
public interface IPlatformPublisherGateway {

    PlatformEnum platform();

    PublishResult publish(ArtifactRef artifact, Map<String, String> credentials, String caption);
}

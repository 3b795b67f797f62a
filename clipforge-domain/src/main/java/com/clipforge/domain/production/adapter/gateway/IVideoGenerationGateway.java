package com.clipforge.domain.production.adapter.gateway;

import com.clipforge.domain.production.model.valobj.JobHandle;
import com.clipforge.domain.production.model.valobj.JobPollResult;
import com.clipforge.domain.production.model.valobj.VideoGenerationRequest;

/**
 * 异步视频生成后端。
 * <p>
 * 瞬时故障抛出 {@link com.clipforge.types.exception.TransientProviderException}，
 * 其余异常视为不可重试。
 * </p>
 */
public interface IVideoGenerationGateway {

    JobHandle submit(VideoGenerationRequest request);

    JobPollResult poll(JobHandle handle);
}

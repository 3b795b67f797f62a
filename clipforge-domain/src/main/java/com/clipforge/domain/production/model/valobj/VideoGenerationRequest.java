package com.clipforge.domain.production.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 提交给视频生成后端的请求。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VideoGenerationRequest {

    /**
     * 本地生产任务 ID，作为幂等/关联键传给后端
     */
    private String jobId;

    private Long channelId;

    private String productName;

    private String personaDescription;

    private StoryboardSpec storyboard;

    /**
     * 画幅，竖屏为 portrait
     */
    private String aspectRatio;
}

package com.clipforge.config;

import com.clipforge.types.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时校验视频生成后端配置。调度开启时缺少 base-url 直接启动失败。
 */
@Slf4j
@Component
public class VideoBackendConfigCheckRunner implements ApplicationRunner {

    private final boolean schedulerEnabled;
    private final String baseUrl;
    private final String apiKey;

    public VideoBackendConfigCheckRunner(@Value("${clipforge.scheduler.enabled:true}") boolean schedulerEnabled,
                                         @Value("${clipforge.video.base-url:}") String baseUrl,
                                         @Value("${clipforge.video.api-key:}") String apiKey) {
        this.schedulerEnabled = schedulerEnabled;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!schedulerEnabled) {
            log.info("Skip video backend config check because clipforge.scheduler.enabled=false");
            return;
        }
        if (StringUtils.isBlank(baseUrl)) {
            throw new ConfigurationException("clipforge.video.base-url is required when the scheduler is enabled");
        }
        if (StringUtils.isBlank(apiKey)) {
            log.warn("clipforge.video.api-key is blank, video backend requests are sent without credentials");
        }
        log.info("Video backend config check passed. baseUrl={}", baseUrl);
    }
}

package com.clipforge.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * 外部 HTTP 协作方客户端配置。
 * <p>
 * 视频后端、素材下载、平台发布各用一个 RestTemplate，超时相互独立。
 * </p>
 */
@Configuration
public class HttpClientConfig {

    @Bean(name = "videoRestTemplate")
    public RestTemplate videoRestTemplate(
            @Value("${clipforge.video.connect-timeout-ms:10000}") int connectTimeoutMs,
            @Value("${clipforge.video.read-timeout-ms:30000}") int readTimeoutMs) {
        return build(connectTimeoutMs, readTimeoutMs);
    }

    @Bean(name = "storageRestTemplate")
    public RestTemplate storageRestTemplate(
            @Value("${clipforge.storage.connect-timeout-ms:10000}") int connectTimeoutMs,
            @Value("${clipforge.storage.read-timeout-ms:120000}") int readTimeoutMs) {
        return build(connectTimeoutMs, readTimeoutMs);
    }

    @Bean(name = "publisherRestTemplate")
    public RestTemplate publisherRestTemplate(
            @Value("${clipforge.publisher.connect-timeout-ms:10000}") int connectTimeoutMs,
            @Value("${clipforge.publisher.read-timeout-ms:60000}") int readTimeoutMs) {
        return build(connectTimeoutMs, readTimeoutMs);
    }

    private RestTemplate build(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Math.max(connectTimeoutMs, 1));
        factory.setReadTimeout(Math.max(readTimeoutMs, 1));
        return new RestTemplate(factory);
    }
}

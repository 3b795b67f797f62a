package com.clipforge.infrastructure.gateway.publisher;

import com.clipforge.infrastructure.util.JsonCodec;
import com.clipforge.types.common.Constants;
import com.clipforge.types.enums.PlatformEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Instagram Reels 发布，需要 ig_user_id。
 */
@Component
public class InstagramPublisherGateway extends AbstractHttpPlatformPublisher {

    public InstagramPublisherGateway(@Qualifier("publisherRestTemplate") RestTemplate restTemplate,
                                     JsonCodec jsonCodec,
                                     @Value("${clipforge.publisher.instagram.endpoint:}") String endpoint) {
        super(restTemplate, jsonCodec, endpoint);
    }

    @Override
    public PlatformEnum platform() {
        return PlatformEnum.INSTAGRAM;
    }

    @Override
    protected String missingCredential(Map<String, String> credentials) {
        return StringUtils.isBlank(credentials.get(Constants.CREDENTIAL_IG_USER_ID)) ? Constants.CREDENTIAL_IG_USER_ID : null;
    }

    @Override
    protected void customizeBody(Map<String, Object> body, Map<String, String> credentials) {
        body.put("media_type", "REELS");
        body.put(Constants.CREDENTIAL_IG_USER_ID, credentials.get(Constants.CREDENTIAL_IG_USER_ID));
    }
}

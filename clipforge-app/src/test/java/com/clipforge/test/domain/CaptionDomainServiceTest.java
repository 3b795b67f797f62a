package com.clipforge.test.domain;

import com.clipforge.domain.channel.model.entity.ProductEntity;
import com.clipforge.domain.production.model.valobj.AnalysisResult;
import com.clipforge.domain.production.service.CaptionDomainService;
import com.clipforge.test.support.ChannelFixtures;
import com.clipforge.types.enums.PlatformEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class CaptionDomainServiceTest {

    private final CaptionDomainService caption = new CaptionDomainService();

    @Test
    public void shouldComposeProductBenefitHashtagsAndDisclosure() {
        ProductEntity product = ChannelFixtures.product(100L);
        AnalysisResult analysis = AnalysisResult.builder()
                .benefits(List.of("", "brighter skin in two weeks"))
                .targetAudience("women 25-40")
                .build();

        String text = caption.buildCaption(product, analysis, PlatformEnum.TIKTOK);

        Assertions.assertEquals("Check out GlowSerum! Brighter skin in two weeks. #fyp #tiktokmademebuyit #ad", text);
    }

    @Test
    public void shouldFallBackWhenProductAndAnalysisMissing() {
        String text = caption.buildCaption(null, null, PlatformEnum.YOUTUBE);

        Assertions.assertEquals("Check out this! #shorts #ad", text);
    }

    @Test
    public void shouldTruncateBodyButKeepHashtagsWhenOverPlatformLimit() {
        ProductEntity product = ChannelFixtures.product(100L);
        AnalysisResult analysis = AnalysisResult.builder()
                .benefits(List.of("x".repeat(3000)))
                .targetAudience("everyone")
                .build();

        String text = caption.buildCaption(product, analysis, PlatformEnum.INSTAGRAM);

        Assertions.assertEquals(PlatformEnum.INSTAGRAM.getCaptionLimit(), text.length());
        Assertions.assertTrue(text.endsWith("#reels #instagood #ad"));
        Assertions.assertTrue(text.startsWith("Check out GlowSerum!"));
    }
}

package com.clipforge.domain.production.service;

import com.clipforge.domain.channel.model.entity.ProductEntity;
import com.clipforge.domain.production.model.valobj.AnalysisResult;
import com.clipforge.types.enums.PlatformEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 发布文案：产品名 + 首要卖点 + 平台话题标签，结尾固定带 #ad 披露。
 * 超出平台长度时截断正文，话题与披露保留。
 */
@Service
public class CaptionDomainService {

    private static final String DISCLOSURE = "#ad";

    public String buildCaption(ProductEntity product, AnalysisResult analysis, PlatformEnum platform) {
        String productName = product == null ? null : StringUtils.trimToNull(product.getName());
        String benefit = analysis == null ? null : StringUtils.trimToNull(analysis.primaryBenefit());

        StringBuilder body = new StringBuilder();
        body.append(productName == null ? "Check out this!" : "Check out " + productName + "!");
        if (benefit != null) {
            body.append(' ').append(StringUtils.capitalize(benefit));
            if (!StringUtils.endsWithAny(benefit, ".", "!", "?")) {
                body.append('.');
            }
        }

        List<String> hashtags = platform == null ? List.of() : platform.getDefaultHashtags();
        String tail = hashtags.isEmpty() ? DISCLOSURE : String.join(" ", hashtags) + " " + DISCLOSURE;
        int limit = platform == null ? Integer.MAX_VALUE : platform.getCaptionLimit();
        int bodyBudget = limit - tail.length() - 1;
        String bodyText = body.toString();
        if (bodyBudget <= 0) {
            return StringUtils.truncate(tail, limit);
        }
        if (bodyText.length() > bodyBudget) {
            bodyText = StringUtils.abbreviate(bodyText, Math.max(bodyBudget, 4));
        }
        return bodyText + " " + tail;
    }
}

package com.clipforge.infrastructure.ai;

import com.clipforge.domain.channel.model.entity.ProductEntity;
import com.clipforge.domain.channel.model.valobj.PersonaProfile;
import com.clipforge.domain.production.adapter.gateway.IScriptGateway;
import com.clipforge.domain.production.model.valobj.AnalysisResult;
import com.clipforge.infrastructure.util.JsonCodec;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 ChatClient 的候选脚本生成实现，每个候选一次调用。
 */
@Slf4j
@Component
public class ScriptGatewayImpl extends AbstractChatGateway implements IScriptGateway {

    public ScriptGatewayImpl(ChatClient chatClient, JsonCodec jsonCodec) {
        super(chatClient, jsonCodec);
    }

    @Override
    public List<String> generateScripts(ProductEntity product,
                                        AnalysisResult analysis,
                                        PersonaProfile persona,
                                        int count) {
        int normalizedCount = Math.max(count, 1);
        List<String> scripts = new ArrayList<>(normalizedCount);
        for (int i = 1; i <= normalizedCount; i++) {
            String script = callForText("script", buildPrompt(product, analysis, persona, i));
            scripts.add(script);
        }
        log.debug("Script candidates generated. productId={}, count={}", product.getId(), scripts.size());
        return scripts;
    }

    private String buildPrompt(ProductEntity product, AnalysisResult analysis, PersonaProfile persona, int variant) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Write a 25 second UGC video script, variant ").append(variant).append(".");
        prompt.append(" Use exactly three scenes marked (Scene 1: 0-8s), (Scene 2: 8-17s), (Scene 3: 17-25s).");
        prompt.append(" Scene dialogue lengths: 18-22 words, 20-24 words, 17-20 words.");
        prompt.append(" Return only the script.");
        prompt.append("\nCreator: ").append(persona.getName());
        if (StringUtils.isNotBlank(persona.getOccupation())) {
            prompt.append(", ").append(persona.getOccupation());
        }
        prompt.append("\nProduct: ").append(StringUtils.defaultString(product.getName()));
        prompt.append("\nBenefits: ").append(String.join("; ", analysis.getBenefits()));
        if (analysis.getPainPoints() != null && !analysis.getPainPoints().isEmpty()) {
            prompt.append("\nPain points: ").append(String.join("; ", analysis.getPainPoints()));
        }
        if (StringUtils.isNotBlank(analysis.getTone())) {
            prompt.append("\nTone: ").append(analysis.getTone());
        }
        return prompt.toString();
    }
}

package com.clipforge.infrastructure.ai;

import com.clipforge.infrastructure.util.JsonCodec;
import com.clipforge.types.exception.ContractValidationException;
import com.clipforge.types.exception.TransientProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.util.ArrayList;
import java.util.List;

/**
 * LLM 提供方公共调用：网络/5xx 归为瞬时故障，返回内容在边界处解析为 JSON。
 */
@Slf4j
public abstract class AbstractChatGateway {

    protected final ChatClient chatClient;
    protected final JsonCodec jsonCodec;

    protected AbstractChatGateway(ChatClient chatClient, JsonCodec jsonCodec) {
        this.chatClient = chatClient;
        this.jsonCodec = jsonCodec;
    }

    protected String callForText(String stage, String prompt) {
        String content;
        try {
            ChatClient.CallResponseSpec response = chatClient.prompt(prompt).call();
            content = response == null ? null : response.content();
        } catch (ResourceAccessException | HttpServerErrorException ex) {
            throw new TransientProviderException(stage + " provider unavailable: " + ex.getMessage(), ex);
        }
        if (StringUtils.isBlank(content)) {
            throw new ContractValidationException(stage + " provider returned empty content");
        }
        return content.trim();
    }

    protected JsonNode callForJson(String stage, String prompt) {
        String content = callForText(stage, prompt);
        JsonNode node = tryReadTree(content);
        if (node != null && node.isObject()) {
            return node;
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start >= 0 && end > start) {
            node = tryReadTree(content.substring(start, end + 1));
            if (node != null && node.isObject()) {
                return node;
            }
        }
        throw new ContractValidationException(stage + " provider did not return a JSON object");
    }

    protected String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && StringUtils.isNotBlank(value.asText())) {
                return value.asText().trim();
            }
        }
        return null;
    }

    protected List<String> textList(JsonNode node, String... fields) {
        List<String> values = new ArrayList<>();
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isArray()) {
                value.forEach(item -> {
                    if (StringUtils.isNotBlank(item.asText())) {
                        values.add(item.asText().trim());
                    }
                });
            } else if (StringUtils.isNotBlank(value.asText())) {
                values.add(value.asText().trim());
            }
            if (!values.isEmpty()) {
                break;
            }
        }
        return values;
    }

    private JsonNode tryReadTree(String text) {
        try {
            return jsonCodec.readTree(text);
        } catch (Exception ex) {
            log.debug("Failed to parse provider json: {}", ex.getMessage());
            return null;
        }
    }
}

package com.clipforge.infrastructure.util;

import com.clipforge.types.enums.ResponseCode;
import com.clipforge.types.exception.AppException;
import com.clipforge.types.exception.ContractValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * JSON 编解码，JSONB 列、外部服务响应与 LLM 返回内容共用。
 * <p>
 * 空白输入读为 null；无法解析的内容视为外部数据违反契约，抛出 {@link ContractValidationException}。
 * </p>
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> STRING_MAP_REF = new TypeReference<>() {};
    private static final int PREVIEW_LENGTH = 120;

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> readMap(String json) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, MAP_REF);
        } catch (JsonProcessingException ex) {
            throw unreadable(json, ex);
        }
    }

    /**
     * 凭证等扁平字符串映射；非字符串值按文本读取。
     */
    public Map<String, String> readStringMap(String json) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, STRING_MAP_REF);
        } catch (JsonProcessingException ex) {
            throw unreadable(json, ex);
        }
    }

    public <T> T readValue(String json, Class<T> type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw unreadable(json, ex);
        }
    }

    public JsonNode readTree(String json) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw unreadable(json, ex);
        }
    }

    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Failed to write json: " + value.getClass().getSimpleName(), ex);
        }
    }

    private ContractValidationException unreadable(String json, JsonProcessingException ex) {
        return new ContractValidationException("Unreadable json: "
                + StringUtils.abbreviate(json.trim(), PREVIEW_LENGTH), ex);
    }
}

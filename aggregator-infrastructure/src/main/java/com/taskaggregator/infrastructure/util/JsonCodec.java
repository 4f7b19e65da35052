package com.taskaggregator.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskaggregator.types.enums.ResponseCode;
import com.taskaggregator.types.exception.AppException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON 编解码工具。
 *
 * @author getoffer
 * @since 2026-10-19
 */
@Component
public class JsonCodec {

    private final ObjectMapper objectMapper;

    /**
     * 创建 JsonCodec。
     */
    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 生成签名用的规范消息：紧凑 JSON，字段顺序固定为 task、response。
     * 例如 {"task":7,"response":"42"}，签名方与校验方必须使用同一实现。
     */
    public String writeCanonicalResponseMessage(Long taskId, String response) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("task", taskId);
        message.put("response", response);
        return writeValue(message);
    }

    /**
     * 写出为 JSON 字符串。
     */
    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to write json", ex);
        }
    }
}

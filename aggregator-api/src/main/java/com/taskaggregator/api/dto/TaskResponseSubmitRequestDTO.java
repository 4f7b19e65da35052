package com.taskaggregator.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Operator 提交任务响应请求 DTO
 */
@Data
public class TaskResponseSubmitRequestDTO {

    /**
     * 响应内容，仅做字符串相等比较
     */
    @NotBlank(message = "request.response is required")
    private String response;

    /**
     * 提交响应的 Operator ID
     */
    @NotNull(message = "request.operatorId is required")
    private Long operatorId;

    /**
     * Operator 对 {task, response} 规范消息的签名（Base64）
     */
    @NotBlank(message = "request.signature is required")
    private String signature;
}

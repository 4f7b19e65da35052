package com.taskaggregator.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 创建任务请求 DTO
 */
@Data
public class TaskCreateRequestDTO {

    /**
     * 任务输入（序列化后的原始载荷，聚合服务不解析）
     */
    @NotBlank(message = "request.input is required")
    private String input;
}

package com.taskaggregator.api.dto;

import lombok.Data;

/**
 * 已入库的 Operator 响应 DTO。
 */
@Data
public class TaskResponseDTO {

    private Long id;
    private Long taskId;
    private Long operatorId;
    private String response;
    private String signature;
    private Long createdAt;
}

package com.taskaggregator.api.dto;

import lombok.Data;

/**
 * 下发给 Operator 的任务 DTO，只包含计算所需字段。
 */
@Data
public class TaskDTO {

    private Long id;
    private Long createdAt;
    private String input;
}

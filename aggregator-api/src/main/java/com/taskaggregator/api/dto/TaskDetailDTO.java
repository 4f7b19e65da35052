package com.taskaggregator.api.dto;

import lombok.Data;

/**
 * 任务详情 DTO。
 */
@Data
public class TaskDetailDTO {

    private Long id;
    private String status;
    private Long createdAt;
    private String input;
    private String response;
    private Long finalizedAt;
    private Long responsesCount;
}

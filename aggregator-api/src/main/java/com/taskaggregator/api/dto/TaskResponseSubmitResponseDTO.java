package com.taskaggregator.api.dto;

import lombok.Data;

/**
 * 提交响应结果 DTO：响应已入库，附带入库后触发的共识判定结果。
 */
@Data
public class TaskResponseSubmitResponseDTO {

    private Long taskId;
    private Long responseId;
    private Long operatorId;
    private TaskEvaluationDTO evaluation;
}

package com.taskaggregator.api.dto;

import lombok.Data;

/**
 * 共识判定结果 DTO。
 */
@Data
public class TaskEvaluationDTO {

    /**
     * finalized / deferred / undecidable / already_finalized
     */
    private String outcome;

    private Long taskId;

    /**
     * 当前已入库的响应数
     */
    private Long responsesCount;

    /**
     * 判定时读取的有资格 Operator 数
     */
    private Integer operatorsCount;

    /**
     * 参与度所需最少响应数
     */
    private Integer quorum;

    /**
     * 共识结果，仅 finalized 时有值
     */
    private String response;

    private String message;
}

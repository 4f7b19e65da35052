package com.taskaggregator.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务共识判定结果枚举
 */
public enum TaskEvaluationOutcomeEnum {

    /**
     * 已判定 - 参与度与内容一致性均达标，任务完成
     */
    FINALIZED("finalized"),

    /**
     * 暂缓 - 响应数量未达到参与度门槛，等待更多响应
     */
    DEFERRED("deferred"),

    /**
     * 无法判定 - 参与度达标但内容一致性不足，任务进入 CONSENSUS_NOT_REACHED
     */
    UNDECIDABLE("undecidable"),

    /**
     * 已终态 - 任务此前已被判定，本次不做任何写入
     */
    ALREADY_FINALIZED("already_finalized");

    private final String code;

    TaskEvaluationOutcomeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}

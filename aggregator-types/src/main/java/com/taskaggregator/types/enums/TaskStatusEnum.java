package com.taskaggregator.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务状态枚举
 *
 * @author getoffer
 * @since 2026-10-19
 */
public enum TaskStatusEnum {

    /**
     * 就绪 - 任务已创建，等待 Operator 提交响应
     */
    READY("READY"),

    /**
     * 已完成 - 响应达成共识，结果已写入任务
     */
    COMPLETED("COMPLETED"),

    /**
     * 未达成共识 - 参与度达标但响应内容分歧过大，终态
     */
    CONSENSUS_NOT_REACHED("CONSENSUS_NOT_REACHED");

    private final String code;

    TaskStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 是否为终态。终态任务不允许再被修改。
     */
    public boolean isTerminal() {
        return this != READY;
    }
}

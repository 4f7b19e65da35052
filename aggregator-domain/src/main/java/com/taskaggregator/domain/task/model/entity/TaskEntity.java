package com.taskaggregator.domain.task.model.entity;

import com.taskaggregator.types.enums.TaskStatusEnum;
import lombok.Data;

/**
 * 任务领域实体
 *
 * @author getoffer
 * @since 2026-10-19
 */
@Data
public class TaskEntity {

    /**
     * 主键 ID (按创建顺序递增)
     */
    private Long id;

    /**
     * 状态
     */
    private TaskStatusEnum status;

    /**
     * 创建时间 (epoch 毫秒)，决定下发顺序
     */
    private Long createdAt;

    /**
     * 任务输入 (序列化载荷，不解析)
     */
    private String input;

    /**
     * 共识结果，仅 COMPLETED 时有值
     */
    private String response;

    /**
     * 进入终态的时间 (epoch 毫秒)
     */
    private Long finalizedAt;

    /**
     * 创建 READY 任务
     */
    public static TaskEntity create(String input, long nowMs) {
        TaskEntity task = new TaskEntity();
        task.setStatus(TaskStatusEnum.READY);
        task.setInput(input);
        task.setCreatedAt(nowMs);
        return task;
    }

    /**
     * 验证任务是否有效
     */
    public void validate() {
        if (input == null) {
            throw new IllegalStateException("Input cannot be null");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalStateException("Created at cannot be null");
        }
        if (status != TaskStatusEnum.COMPLETED && response != null) {
            throw new IllegalStateException("Only COMPLETED tasks carry a response");
        }
    }

    /**
     * 完成任务并写入共识结果
     */
    public void complete(String winningResponse, long nowMs) {
        requireReady();
        this.status = TaskStatusEnum.COMPLETED;
        this.response = winningResponse;
        this.finalizedAt = nowMs;
    }

    /**
     * 标记为无法达成共识
     */
    public void markConsensusNotReached(long nowMs) {
        requireReady();
        this.status = TaskStatusEnum.CONSENSUS_NOT_REACHED;
        this.response = null;
        this.finalizedAt = nowMs;
    }

    /**
     * 检查是否可接收响应
     */
    public boolean isReady() {
        return this.status == TaskStatusEnum.READY;
    }

    /**
     * 检查是否已进入终态
     */
    public boolean isFinalized() {
        return this.status != null && this.status.isTerminal();
    }

    private void requireReady() {
        if (this.status != TaskStatusEnum.READY) {
            throw new IllegalStateException("Task must be in READY status to be finalized, current: " + this.status);
        }
    }
}

package com.taskaggregator.domain.task.model.entity;

import lombok.Data;

/**
 * Operator 任务响应领域实体。
 * <p>
 * 每个 (taskId, operatorId) 至多一条，入库后不可覆盖。
 * </p>
 */
@Data
public class TaskResponseEntity {

    private Long id;
    private Long taskId;
    private Long operatorId;

    /**
     * 响应内容，仅做字符串相等比较
     */
    private String response;

    /**
     * Operator 对 {task, response} 规范消息的签名
     */
    private String signature;

    /**
     * 入库时间 (epoch 毫秒)
     */
    private Long createdAt;

    public static TaskResponseEntity of(Long taskId, Long operatorId, String response, String signature, long nowMs) {
        TaskResponseEntity entity = new TaskResponseEntity();
        entity.setTaskId(taskId);
        entity.setOperatorId(operatorId);
        entity.setResponse(response);
        entity.setSignature(signature == null ? "" : signature);
        entity.setCreatedAt(nowMs);
        return entity;
    }
}

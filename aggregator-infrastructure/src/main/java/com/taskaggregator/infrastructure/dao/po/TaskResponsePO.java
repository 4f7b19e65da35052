package com.taskaggregator.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Operator 任务响应 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResponsePO {

    private Long id;
    private Long taskId;
    private Long operatorId;
    private String response;
    private String signature;
    private Long createdAt;
}

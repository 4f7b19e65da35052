package com.taskaggregator.infrastructure.dao.po;

import com.taskaggregator.types.enums.TaskStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 任务 PO
 *
 * @author getoffer
 * @since 2026-10-19
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskPO {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 状态
     */
    private TaskStatusEnum status;

    /**
     * 创建时间 (epoch 毫秒)
     */
    private Long createdAt;

    /**
     * 任务输入
     */
    private String input;

    /**
     * 共识结果
     */
    private String response;

    /**
     * 终态写入时间 (epoch 毫秒)
     */
    private Long finalizedAt;
}

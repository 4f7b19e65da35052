package com.taskaggregator.infrastructure.dao;

import com.taskaggregator.infrastructure.dao.po.TaskResponsePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Operator 任务响应 DAO。
 */
@Mapper
public interface TaskResponseDao {

    /**
     * INSERT ... SELECT ... WHERE 任务为 READY ... ON CONFLICT (task_id, operator_id) DO NOTHING
     *
     * @return 1 插入成功；0 唯一键冲突或任务已终态
     */
    int insertIfTaskReady(TaskResponsePO po);

    List<TaskResponsePO> selectByTaskId(@Param("taskId") Long taskId);

    Long countByTaskId(@Param("taskId") Long taskId);

    TaskResponsePO selectByTaskIdAndOperatorId(@Param("taskId") Long taskId,
                                               @Param("operatorId") Long operatorId);
}

package com.taskaggregator.infrastructure.dao;

import com.taskaggregator.infrastructure.dao.po.TaskPO;
import com.taskaggregator.types.enums.TaskStatusEnum;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 任务 DAO
 *
 * @author getoffer
 * @since 2026-10-19
 */
@Mapper
public interface TaskDao {

    /**
     * 插入任务
     */
    int insert(TaskPO po);

    /**
     * 根据 ID 查询
     */
    TaskPO selectById(@Param("id") Long id);

    /**
     * 查询 Operator 尚未响应的最早 READY 任务 (anti-join task_response)
     */
    TaskPO selectNextReadyForOperator(@Param("operatorId") Long operatorId,
                                      @Param("status") TaskStatusEnum status);

    /**
     * 查询已有响应的 READY 任务
     */
    List<TaskPO> selectReadyWithResponses(@Param("status") TaskStatusEnum status,
                                          @Param("afterId") Long afterId,
                                          @Param("limit") Integer limit);

    /**
     * 条件更新：仅当 status = fromStatus 时写入终态。
     */
    int updateStatusGuarded(@Param("id") Long id,
                            @Param("fromStatus") TaskStatusEnum fromStatus,
                            @Param("toStatus") TaskStatusEnum toStatus,
                            @Param("response") String response,
                            @Param("finalizedAt") Long finalizedAt);

    /**
     * 按状态统计
     */
    Long countByStatus(@Param("status") TaskStatusEnum status);
}

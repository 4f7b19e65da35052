package com.taskaggregator.trigger.application.command;

import com.taskaggregator.domain.task.adapter.repository.ITaskRepository;
import com.taskaggregator.domain.task.adapter.repository.ITaskResponseRepository;
import com.taskaggregator.domain.task.model.entity.TaskEntity;
import com.taskaggregator.domain.task.model.entity.TaskResponseEntity;
import com.taskaggregator.domain.task.model.valobj.TaskEvaluationResult;
import com.taskaggregator.trigger.application.common.OperatorGatewayInvoker;
import com.taskaggregator.types.enums.ResponseCode;
import com.taskaggregator.types.enums.TaskStatusEnum;
import com.taskaggregator.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.concurrent.locks.Lock;

/**
 * Operator 响应准入写用例。
 * <p>
 * 顺序：任务存在 → Operator 资格 → 签名 → [任务锁内] 重复提交 → 任务仍为 READY → 条件写入 → 触发判定。
 * 认证未完成（协作方不可用）时不会写入任何数据；判定失败不回滚已写入的响应。
 * </p>
 */
@Slf4j
@Service
public class TaskResponseAdmissionService {

    private final ITaskRepository taskRepository;
    private final ITaskResponseRepository taskResponseRepository;
    private final OperatorGatewayInvoker operatorGatewayInvoker;
    private final TaskEvaluationApplicationService taskEvaluationApplicationService;
    private final Counter admittedCounter;

    public TaskResponseAdmissionService(ITaskRepository taskRepository,
                                        ITaskResponseRepository taskResponseRepository,
                                        OperatorGatewayInvoker operatorGatewayInvoker,
                                        TaskEvaluationApplicationService taskEvaluationApplicationService) {
        this.taskRepository = taskRepository;
        this.taskResponseRepository = taskResponseRepository;
        this.operatorGatewayInvoker = operatorGatewayInvoker;
        this.taskEvaluationApplicationService = taskEvaluationApplicationService;
        this.admittedCounter = Counter.builder("aggregator.response.admitted.total").register(Metrics.globalRegistry);
    }

    public AdmissionResult admit(Long taskId, Long operatorId, String response, String signature) {
        if (taskId == null || operatorId == null || response == null || StringUtils.isBlank(signature)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "taskId, operatorId, response and signature are required");
        }
        log.info("TASK_RESPONSE_RECEIVED taskId={}, operatorId={}", taskId, operatorId);

        TaskEntity task = taskRepository.findById(taskId);
        if (task == null) {
            throw new AppException(ResponseCode.TASK_NOT_FOUND, "Task not found: " + taskId);
        }

        if (!operatorGatewayInvoker.isEligible(operatorId)) {
            log.warn("TASK_RESPONSE_REJECTED taskId={}, operatorId={}, reason=unauthorized", taskId, operatorId);
            throw new AppException(ResponseCode.OPERATOR_UNAUTHORIZED, "Operator is not eligible: " + operatorId);
        }
        log.info("TASK_RESPONSE_OPERATOR_VERIFIED taskId={}, operatorId={}", taskId, operatorId);

        if (!operatorGatewayInvoker.verify(taskId, response, operatorId, signature)) {
            log.warn("TASK_RESPONSE_REJECTED taskId={}, operatorId={}, reason=invalid_signature", taskId, operatorId);
            throw new AppException(ResponseCode.INVALID_SIGNATURE, "Signature does not match operator key");
        }
        log.info("TASK_RESPONSE_SIGNATURE_VERIFIED taskId={}, operatorId={}", taskId, operatorId);

        TaskResponseEntity entity = TaskResponseEntity.of(taskId, operatorId, response, signature, System.currentTimeMillis());
        Lock lock = taskEvaluationApplicationService.taskLock(taskId);
        lock.lock();
        try {
            // 认证期间任务可能已被终结，须在锁内复核
            TaskEntity current = taskRepository.findById(taskId);
            if (current == null) {
                throw new AppException(ResponseCode.TASK_NOT_FOUND, "Task not found: " + taskId);
            }
            if (taskResponseRepository.findByTaskIdAndOperatorId(taskId, operatorId) != null) {
                throw duplicate(taskId, operatorId);
            }
            if (!current.isReady()) {
                throw alreadyFinalized(taskId, operatorId, current.getStatus());
            }
            if (!taskResponseRepository.insertIfAbsent(entity)) {
                if (taskResponseRepository.findByTaskIdAndOperatorId(taskId, operatorId) != null) {
                    throw duplicate(taskId, operatorId);
                }
                // 其它进程已终结任务
                throw alreadyFinalized(taskId, operatorId, null);
            }
        } finally {
            lock.unlock();
        }
        admittedCounter.increment();
        log.info("TASK_RESPONSE_SAVED taskId={}, operatorId={}, responseId={}", taskId, operatorId, entity.getId());

        TaskEvaluationResult evaluation = null;
        try {
            evaluation = taskEvaluationApplicationService.evaluate(taskId);
            log.info("TASK_RESPONSE_EVALUATED taskId={}, outcome={}", taskId, evaluation.outcome().getCode());
        } catch (Exception ex) {
            log.warn("TASK_RESPONSE_EVALUATION_FAILED taskId={}, operatorId={}, error={}",
                    taskId, operatorId, ex.getMessage(), ex);
        }
        return new AdmissionResult(entity, evaluation);
    }

    private AppException alreadyFinalized(Long taskId, Long operatorId, TaskStatusEnum status) {
        log.info("TASK_RESPONSE_REJECTED taskId={}, operatorId={}, reason=already_finalized, status={}",
                taskId, operatorId, status);
        return new AppException(ResponseCode.TASK_ALREADY_FINALIZED, "Task already finalized: " + taskId);
    }

    private AppException duplicate(Long taskId, Long operatorId) {
        log.info("TASK_RESPONSE_REJECTED taskId={}, operatorId={}, reason=duplicate", taskId, operatorId);
        return new AppException(ResponseCode.DUPLICATE_RESPONSE,
                "Operator " + operatorId + " already responded to task " + taskId);
    }

    /**
     * @param evaluation 准入后的判定结果；判定异常时为 null
     */
    public record AdmissionResult(TaskResponseEntity response, TaskEvaluationResult evaluation) {
    }
}

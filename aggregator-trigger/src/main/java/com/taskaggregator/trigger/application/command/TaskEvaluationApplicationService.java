package com.taskaggregator.trigger.application.command;

import com.google.common.util.concurrent.Striped;
import com.taskaggregator.domain.task.adapter.repository.ITaskRepository;
import com.taskaggregator.domain.task.adapter.repository.ITaskResponseRepository;
import com.taskaggregator.domain.task.model.entity.TaskEntity;
import com.taskaggregator.domain.task.model.entity.TaskResponseEntity;
import com.taskaggregator.domain.task.model.valobj.ContentQuorum;
import com.taskaggregator.domain.task.model.valobj.ParticipationQuorum;
import com.taskaggregator.domain.task.model.valobj.TaskEvaluationResult;
import com.taskaggregator.domain.task.service.QuorumPolicyDomainService;
import com.taskaggregator.trigger.application.common.OperatorGatewayInvoker;
import com.taskaggregator.types.enums.ResponseCode;
import com.taskaggregator.types.enums.TaskEvaluationOutcomeEnum;
import com.taskaggregator.types.enums.TaskStatusEnum;
import com.taskaggregator.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;

/**
 * 任务判定写用例：参与度 → 内容一致性 → 终态写入。
 * <p>
 * 同一任务的判定在进程内由分段锁串行化，不同任务互不阻塞；
 * 跨进程时由仓储的 READY 条件更新保证只有一个写者胜出，失败方返回 ALREADY_FINALIZED。
 * </p>
 *
 * @author getoffer
 * @since 2026-10-19
 */
@Slf4j
@Service
public class TaskEvaluationApplicationService {

    private static final int LOCK_STRIPES = 1024;

    private final ITaskRepository taskRepository;
    private final ITaskResponseRepository taskResponseRepository;
    private final QuorumPolicyDomainService quorumPolicyDomainService;
    private final OperatorGatewayInvoker operatorGatewayInvoker;
    private final Striped<Lock> taskLocks = Striped.lock(LOCK_STRIPES);
    private final Map<TaskEvaluationOutcomeEnum, Counter> outcomeCounters = new EnumMap<>(TaskEvaluationOutcomeEnum.class);

    public TaskEvaluationApplicationService(ITaskRepository taskRepository,
                                            ITaskResponseRepository taskResponseRepository,
                                            QuorumPolicyDomainService quorumPolicyDomainService,
                                            OperatorGatewayInvoker operatorGatewayInvoker) {
        this.taskRepository = taskRepository;
        this.taskResponseRepository = taskResponseRepository;
        this.quorumPolicyDomainService = quorumPolicyDomainService;
        this.operatorGatewayInvoker = operatorGatewayInvoker;
        for (TaskEvaluationOutcomeEnum outcome : TaskEvaluationOutcomeEnum.values()) {
            outcomeCounters.put(outcome, Counter.builder("aggregator.evaluation.outcome.total")
                    .tag("outcome", outcome.getCode())
                    .register(Metrics.globalRegistry));
        }
    }

    public TaskEvaluationResult evaluate(Long taskId) {
        if (taskId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "taskId is required");
        }
        Lock lock = taskLock(taskId);
        lock.lock();
        try {
            TaskEvaluationResult result = evaluateLocked(taskId);
            outcomeCounters.get(result.outcome()).increment();
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 任务级互斥锁，准入写入与判定共用，保证状态复核与写入之间任务不会被本进程终结。
     */
    Lock taskLock(Long taskId) {
        return taskLocks.get(taskId);
    }

    private TaskEvaluationResult evaluateLocked(Long taskId) {
        TaskEntity task = taskRepository.findById(taskId);
        if (task == null) {
            throw new AppException(ResponseCode.TASK_NOT_FOUND, "Task not found: " + taskId);
        }
        if (task.isFinalized()) {
            log.debug("TASK_EVALUATION_SKIPPED taskId={}, status={}", taskId, task.getStatus());
            return TaskEvaluationResult.alreadyFinalized(taskId, task.getResponse());
        }

        int operatorsCount = operatorGatewayInvoker.currentOperatorCount();
        long responsesCount = taskResponseRepository.countByTaskId(taskId);
        ParticipationQuorum participation = quorumPolicyDomainService.checkParticipation(responsesCount, operatorsCount);
        if (!participation.reached()) {
            log.info("TASK_EVALUATION_DEFERRED taskId={}, responses={}, operators={}, quorum={}, outstanding={}",
                    taskId,
                    participation.responsesCount(),
                    participation.operatorsCount(),
                    participation.quorum(),
                    participation.outstanding());
            return TaskEvaluationResult.deferred(taskId, participation);
        }

        List<TaskResponseEntity> responses = taskResponseRepository.findByTaskId(taskId);
        // 计数与枚举之间可能有新响应入库，以枚举结果为准
        if (responses.size() != responsesCount) {
            participation = quorumPolicyDomainService.checkParticipation(responses.size(), operatorsCount);
        }
        ContentQuorum content = quorumPolicyDomainService.checkContent(responses);
        long now = System.currentTimeMillis();

        if (content.reached()) {
            if (!taskRepository.transitionFromReady(taskId, TaskStatusEnum.COMPLETED, content.leadingResponse(), now)) {
                return raceLost(taskId);
            }
            log.info("TASK_EVALUATION_FINALIZED taskId={}, responses={}, operators={}, agreeing={}",
                    taskId, participation.responsesCount(), participation.operatorsCount(), content.leadingCount());
            return TaskEvaluationResult.finalized(taskId, participation, content.leadingResponse());
        }

        if (!taskRepository.transitionFromReady(taskId, TaskStatusEnum.CONSENSUS_NOT_REACHED, null, now)) {
            return raceLost(taskId);
        }
        log.info("TASK_EVALUATION_UNDECIDABLE taskId={}, responses={}, operators={}, leadingCount={}",
                taskId, participation.responsesCount(), participation.operatorsCount(), content.leadingCount());
        return TaskEvaluationResult.undecidable(taskId, participation);
    }

    private TaskEvaluationResult raceLost(Long taskId) {
        TaskEntity current = taskRepository.findById(taskId);
        log.debug("TASK_EVALUATION_RACE_LOST taskId={}, status={}", taskId, current == null ? null : current.getStatus());
        return TaskEvaluationResult.alreadyFinalized(taskId, current == null ? null : current.getResponse());
    }
}

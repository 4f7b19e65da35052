package com.taskaggregator.trigger.job;

import com.taskaggregator.domain.task.adapter.repository.ITaskRepository;
import com.taskaggregator.domain.task.model.entity.TaskEntity;
import com.taskaggregator.domain.task.model.valobj.TaskEvaluationResult;
import com.taskaggregator.trigger.application.command.TaskEvaluationApplicationService;
import com.taskaggregator.types.enums.TaskEvaluationOutcomeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 判定补偿作业：重新判定已有响应但仍为 READY 的任务。
 * <p>
 * Operator 数量下降后，之前 DEFERRED 的任务可能已经满足参与度门槛，只能由这里推进。
 * 按任务 ID 游标分页轮转，长期 DEFERRED 的旧任务不会挤占后续任务。
 * </p>
 */
@Slf4j
@Component
public class TaskEvaluationSweepDaemon {

    private final ITaskRepository taskRepository;
    private final TaskEvaluationApplicationService taskEvaluationApplicationService;
    private final boolean enabled;
    private final int batchSize;
    private final AtomicLong cursor = new AtomicLong();

    public TaskEvaluationSweepDaemon(ITaskRepository taskRepository,
                                     TaskEvaluationApplicationService taskEvaluationApplicationService,
                                     @Value("${evaluation.sweep.enabled:true}") boolean enabled,
                                     @Value("${evaluation.sweep.batch-size:100}") int batchSize) {
        this.taskRepository = taskRepository;
        this.taskEvaluationApplicationService = taskEvaluationApplicationService;
        this.enabled = enabled;
        this.batchSize = batchSize > 0 ? batchSize : 100;
    }

    @Scheduled(fixedDelayString = "${evaluation.sweep.interval-ms:30000}", scheduler = "daemonScheduler")
    public void sweep() {
        if (!enabled) {
            return;
        }
        SweepResult result = sweepOnce();
        if (result.scanned() > 0) {
            log.info("EVALUATION_SWEEP_DONE scanned={}, outcomes={}, errors={}",
                    result.scanned(), result.outcomes(), result.errorCount());
        }
    }

    public SweepResult sweepOnce() {
        List<TaskEntity> candidates = taskRepository.findReadyTasksWithResponses(cursor.get(), batchSize);
        // 满页则从本页末尾继续，不足一页说明已到末尾，下一轮从头开始
        if (candidates.size() < batchSize) {
            cursor.set(0L);
        } else {
            cursor.set(candidates.get(candidates.size() - 1).getId());
        }
        Map<TaskEvaluationOutcomeEnum, Integer> outcomes = new EnumMap<>(TaskEvaluationOutcomeEnum.class);
        int errorCount = 0;
        for (TaskEntity task : candidates) {
            if (task == null || task.getId() == null) {
                continue;
            }
            try {
                TaskEvaluationResult evaluation = taskEvaluationApplicationService.evaluate(task.getId());
                outcomes.merge(evaluation.outcome(), 1, Integer::sum);
            } catch (Exception ex) {
                errorCount++;
                log.warn("EVALUATION_SWEEP_TASK_FAILED taskId={}, error={}", task.getId(), ex.getMessage());
            }
        }
        return new SweepResult(candidates.size(), outcomes, errorCount);
    }

    public record SweepResult(int scanned, Map<TaskEvaluationOutcomeEnum, Integer> outcomes, int errorCount) {

        public int count(TaskEvaluationOutcomeEnum outcome) {
            return outcomes.getOrDefault(outcome, 0);
        }
    }
}

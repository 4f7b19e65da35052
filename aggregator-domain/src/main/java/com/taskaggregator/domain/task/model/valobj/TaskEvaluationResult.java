package com.taskaggregator.domain.task.model.valobj;

import com.taskaggregator.types.enums.TaskEvaluationOutcomeEnum;

/**
 * 一次任务判定的结果值。DEFERRED 是预期内的"尚未"结果，不是错误。
 */
public record TaskEvaluationResult(TaskEvaluationOutcomeEnum outcome,
                                   Long taskId,
                                   long responsesCount,
                                   int operatorsCount,
                                   int quorum,
                                   String response) {

    public static TaskEvaluationResult finalized(Long taskId, ParticipationQuorum participation, String response) {
        return new TaskEvaluationResult(TaskEvaluationOutcomeEnum.FINALIZED, taskId,
                participation.responsesCount(), participation.operatorsCount(), participation.quorum(), response);
    }

    public static TaskEvaluationResult deferred(Long taskId, ParticipationQuorum participation) {
        return new TaskEvaluationResult(TaskEvaluationOutcomeEnum.DEFERRED, taskId,
                participation.responsesCount(), participation.operatorsCount(), participation.quorum(), null);
    }

    public static TaskEvaluationResult undecidable(Long taskId, ParticipationQuorum participation) {
        return new TaskEvaluationResult(TaskEvaluationOutcomeEnum.UNDECIDABLE, taskId,
                participation.responsesCount(), participation.operatorsCount(), participation.quorum(), null);
    }

    /**
     * @param storedResponse 任务此前写入的共识结果，CONSENSUS_NOT_REACHED 时为 null
     */
    public static TaskEvaluationResult alreadyFinalized(Long taskId, String storedResponse) {
        return new TaskEvaluationResult(TaskEvaluationOutcomeEnum.ALREADY_FINALIZED, taskId, 0L, 0, 0, storedResponse);
    }

    public boolean isFinalized() {
        return outcome == TaskEvaluationOutcomeEnum.FINALIZED;
    }

    public boolean isDeferred() {
        return outcome == TaskEvaluationOutcomeEnum.DEFERRED;
    }
}

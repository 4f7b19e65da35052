package com.taskaggregator.domain.task.model.valobj;

/**
 * 参与度判定结果。
 *
 * @param responsesCount 已入库响应数 R
 * @param operatorsCount 有资格 Operator 数 N
 * @param quorum         达标所需最少响应数
 * @param reached        是否达标
 */
public record ParticipationQuorum(long responsesCount, int operatorsCount, int quorum, boolean reached) {

    /**
     * 距离达标还差的响应数
     */
    public long outstanding() {
        return Math.max(quorum - responsesCount, 0L);
    }
}

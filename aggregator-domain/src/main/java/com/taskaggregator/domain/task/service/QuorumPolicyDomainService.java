package com.taskaggregator.domain.task.service;

import com.taskaggregator.domain.task.model.entity.TaskResponseEntity;
import com.taskaggregator.domain.task.model.valobj.ContentQuorum;
import com.taskaggregator.domain.task.model.valobj.ParticipationQuorum;
import com.taskaggregator.domain.task.model.valobj.QuorumThreshold;
import com.taskaggregator.types.common.Constants;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 共识判定领域服务：参与度门槛与内容一致性门槛的纯计算，不读写任何状态。
 * <p>
 * 全部使用整数基点运算：
 * <ul>
 *   <li>参与度达标：N &gt; 0 且 R * 10000 &gt;= Pbps * N</li>
 *   <li>quorum = ceil(Pbps * N / 10000)，即达标所需最少响应数，N = 1 时恒为 1。
 *       注意是向上取整而非 floor：N = 3、Pbps = 9000 时 quorum 为 3 而不是 2，
 *       保证 R &gt;= quorum 与参与度达标完全等价</li>
 *   <li>内容达标：C * 10000 &gt;= Cbps * R</li>
 * </ul>
 * </p>
 */
@Service
public class QuorumPolicyDomainService {

    private final QuorumThreshold threshold;

    public QuorumPolicyDomainService(QuorumThreshold threshold) {
        this.threshold = threshold == null ? QuorumThreshold.defaults() : threshold;
    }

    public QuorumThreshold getThreshold() {
        return threshold;
    }

    public ParticipationQuorum checkParticipation(long responsesCount, int operatorsCount) {
        long normalizedResponses = Math.max(responsesCount, 0L);
        int normalizedOperators = Math.max(operatorsCount, 0);
        int quorum = resolveQuorum(normalizedOperators);
        boolean reached = normalizedOperators > 0
                && normalizedResponses * Constants.BASIS_POINTS_DENOMINATOR
                >= (long) threshold.participationBps() * normalizedOperators;
        return new ParticipationQuorum(normalizedResponses, normalizedOperators, quorum, reached);
    }

    public int resolveQuorum(int operatorsCount) {
        if (operatorsCount <= 0) {
            return 0;
        }
        long numerator = (long) threshold.participationBps() * operatorsCount;
        // participationBps >= 1，所以 N >= 1 时结果至少为 1
        return (int) ((numerator + Constants.BASIS_POINTS_DENOMINATOR - 1) / Constants.BASIS_POINTS_DENOMINATOR);
    }

    public ContentQuorum checkContent(List<TaskResponseEntity> responses) {
        if (responses == null || responses.isEmpty()) {
            return ContentQuorum.empty();
        }
        List<String> values = new ArrayList<>(responses.size());
        for (TaskResponseEntity response : responses) {
            values.add(response == null ? null : response.getResponse());
        }
        return checkContentValues(values);
    }

    /**
     * 按内容精确分组，取成员最多的一组；平票时保留最先出现的一组，保证同一响应序列的结果稳定。
     * null 自成一组，不与空串合并。
     *
     * @param values 按入库顺序排列的响应内容
     */
    public ContentQuorum checkContentValues(List<String> values) {
        if (values == null || values.isEmpty()) {
            return ContentQuorum.empty();
        }
        Map<String, Long> frequency = new LinkedHashMap<>();
        for (String value : values) {
            frequency.merge(value, 1L, Long::sum);
        }

        String leading = null;
        long leadingCount = 0L;
        for (Map.Entry<String, Long> entry : frequency.entrySet()) {
            if (entry.getValue() > leadingCount) {
                leading = entry.getKey();
                leadingCount = entry.getValue();
            }
        }

        long total = values.size();
        boolean reached = leadingCount * Constants.BASIS_POINTS_DENOMINATOR
                >= (long) threshold.contentBps() * total;
        return new ContentQuorum(leading, leadingCount, total, reached);
    }
}

package com.taskaggregator.domain.task.model.valobj;

import com.taskaggregator.types.common.Constants;

/**
 * 共识门槛配置（基点，1..10000）。
 *
 * @param participationBps 参与度门槛
 * @param contentBps       内容一致性门槛
 */
public record QuorumThreshold(int participationBps, int contentBps) {

    public QuorumThreshold {
        requireBasisPoints("participationBps", participationBps);
        requireBasisPoints("contentBps", contentBps);
    }

    public static QuorumThreshold defaults() {
        return new QuorumThreshold(Constants.DEFAULT_PARTICIPATION_THRESHOLD_BPS,
                Constants.DEFAULT_CONTENT_THRESHOLD_BPS);
    }

    private static void requireBasisPoints(String name, int value) {
        if (value < 1 || value > Constants.BASIS_POINTS_DENOMINATOR) {
            throw new IllegalArgumentException(name + " must be within 1.." + Constants.BASIS_POINTS_DENOMINATOR
                    + ", got " + value);
        }
    }
}

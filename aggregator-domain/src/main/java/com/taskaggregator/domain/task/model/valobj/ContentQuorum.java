package com.taskaggregator.domain.task.model.valobj;

/**
 * 内容一致性判定结果。
 *
 * @param leadingResponse 最大相同响应组的内容（平票时取最早入库的一组）
 * @param leadingCount    最大组成员数 C
 * @param totalCount      响应总数 R
 * @param reached         C * 10000 >= Cbps * R
 */
public record ContentQuorum(String leadingResponse, long leadingCount, long totalCount, boolean reached) {

    public static ContentQuorum empty() {
        return new ContentQuorum(null, 0L, 0L, false);
    }
}

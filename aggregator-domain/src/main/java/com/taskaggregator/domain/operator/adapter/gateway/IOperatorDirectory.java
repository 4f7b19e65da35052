package com.taskaggregator.domain.operator.adapter.gateway;

/**
 * Operator 目录端口：提供当前有资格提交响应的 Operator 信息。
 * <p>
 * 实现可以是远程注册中心，调用方需按可超时、可失败的远程调用对待；
 * 调用失败应抛出异常，不允许返回"无资格"来掩盖故障。
 * </p>
 */
public interface IOperatorDirectory {

    /**
     * 当前有资格的 Operator 数量，每次判定都重新读取。
     *
     * @return 非负数
     */
    int currentOperatorCount();

    /**
     * 指定 Operator 当前是否有资格提交响应。
     *
     * @param operatorId Operator ID
     * @return true 有资格
     */
    boolean isEligible(Long operatorId);
}

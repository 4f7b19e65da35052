/**
 * Operator 领域 - 外部 Operator 目录与响应签名校验端口。
 *
 * <p>聚合服务不持有 Operator 身份数据，只通过 gateway 端口读取实时资格与校验签名。</p>
 */
package com.taskaggregator.domain.operator;

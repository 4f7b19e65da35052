package com.taskaggregator.types.common;

/**
 * 全局常量定义类。
 *
 * @author getoffer
 * @since 2026-10-19
 */
public class Constants {

    /** 基点分母，10000 bps = 100% */
    public final static int BASIS_POINTS_DENOMINATOR = 10_000;

    /** 默认参与度门槛：90% 的 Operator 已提交响应 */
    public final static int DEFAULT_PARTICIPATION_THRESHOLD_BPS = 9_000;

    /** 默认内容一致性门槛：90% 的响应内容相同 */
    public final static int DEFAULT_CONTENT_THRESHOLD_BPS = 9_000;

}

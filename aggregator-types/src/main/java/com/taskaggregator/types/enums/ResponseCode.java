package com.taskaggregator.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义聚合服务所有 API 响应的响应码和对应描述信息。
 * 04xx 为调用方输入导致的拒绝，不重试；0503 为外部协作方不可用，可由调用方重试。
 * </p>
 *
 * @author getoffer
 * @since 2026-10-19
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** Operator 未注册或已失去资格 */
    OPERATOR_UNAUTHORIZED("0401", "Operator 无响应资格"),

    /** 签名与 Operator 注册公钥不匹配 */
    INVALID_SIGNATURE("0403", "签名校验失败"),

    /** 任务不存在 */
    TASK_NOT_FOUND("0404", "任务不存在"),

    /** 同一 Operator 对同一任务重复提交 */
    DUPLICATE_RESPONSE("0409", "Operator 已提交过该任务的响应"),

    /** 任务已进入终态 */
    TASK_ALREADY_FINALIZED("0410", "任务已完成判定"),

    /** Operator 目录或签名校验服务不可用 */
    COLLABORATOR_UNAVAILABLE("0503", "外部依赖暂不可用，请稍后重试");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}

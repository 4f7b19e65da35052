package com.taskaggregator.types.exception;

import com.taskaggregator.types.enums.ResponseCode;

/**
 * 外部协作方（Operator 目录、签名校验服务）调用超时或失败。
 * <p>
 * 与 {@link ResponseCode#OPERATOR_UNAUTHORIZED} 严格区分：协作方不可用时无法得出"无资格"的结论，
 * 调用方可以重试，聚合服务内部不做重试。
 * </p>
 */
public class CollaboratorUnavailableException extends AppException {

    private static final long serialVersionUID = -2486120153873120841L;

    /** 出错的协作方名称，例如 operator-directory */
    private final String collaborator;

    public CollaboratorUnavailableException(String collaborator, String message, Throwable cause) {
        super(ResponseCode.COLLABORATOR_UNAVAILABLE.getCode(), message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }

    /**
     * 协作方故障总是可重试的。
     */
    public boolean isRetriable() {
        return true;
    }
}

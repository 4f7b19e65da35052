package com.taskaggregator.types.exception;

import com.taskaggregator.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 统一处理应用中的业务异常，包含异常码和异常描述信息。
 * 所有业务拒绝（任务不存在、签名错误、重复提交等）均通过此类抛出，由 HTTP 层统一转换为响应码。
 * </p>
 *
 * @author getoffer
 * @since 2026-10-19
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 5317680961212299217L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    /**
     * 创建包含响应码和描述信息的 AppException。
     *
     * @param responseCode 响应码
     * @param message 异常描述信息
     */
    public AppException(ResponseCode responseCode, String message) {
        this(responseCode.getCode(), message);
    }

    /**
     * 创建包含异常码和描述信息的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     */
    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    /**
     * 创建包含异常码、描述信息和原因的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     * @param cause 异常原因
     */
    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    /**
     * 是否为指定响应码。
     */
    public boolean is(ResponseCode responseCode) {
        return responseCode != null && responseCode.getCode().equals(code);
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    /**
     * 将异常转换为字符串表示。
     *
     * @return 包含异常码和描述信息的字符串
     */
    @Override
    public String toString() {
        return getClass().getName() + "{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}

package com.taskaggregator.trigger.http;

import com.taskaggregator.api.response.Response;
import com.taskaggregator.types.enums.ResponseCode;
import com.taskaggregator.types.exception.AppException;
import com.taskaggregator.types.exception.CollaboratorUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 统一 API 异常处理。
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    @ExceptionHandler(CollaboratorUnavailableException.class)
    public Response<Object> handleCollaboratorUnavailable(CollaboratorUnavailableException ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, collaborator={}, retriable={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                resolveTraceId(),
                resolveRequestId(),
                ex.getClass().getSimpleName(),
                ex.getCode(),
                ex.getCollaborator(),
                ex.isRetriable(),
                ex.getInfo());
        return Response.<Object>builder()
                .code(ResponseCode.COLLABORATOR_UNAVAILABLE.getCode())
                .info(ResponseCode.COLLABORATOR_UNAVAILABLE.getInfo())
                .build();
    }

    @ExceptionHandler(AppException.class)
    public Response<Object> handleAppException(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo());
        log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                resolveTraceId(),
                resolveRequestId(),
                ex.getClass().getSimpleName(),
                code,
                info);
        return Response.<Object>builder()
                .code(code)
                .info(info)
                .build();
    }

    @ExceptionHandler({
            BindException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public Response<Object> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = truncate(resolveBadRequestMessage(ex), 300);
        log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                resolveTraceId(),
                resolveRequestId(),
                ex.getClass().getSimpleName(),
                ResponseCode.ILLEGAL_PARAMETER.getCode(),
                info);
        return Response.<Object>builder()
                .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                .info(info)
                .build();
    }

    @ExceptionHandler(Exception.class)
    public Response<Object> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                resolveTraceId(),
                resolveRequestId(),
                ex.getClass().getSimpleName(),
                ResponseCode.UN_ERROR.getCode(),
                truncate(ex.getMessage(), 300),
                ex);
        return Response.<Object>builder()
                .code(ResponseCode.UN_ERROR.getCode())
                .info(ResponseCode.UN_ERROR.getInfo())
                .build();
    }

    /**
     * 校验失败时取第一个字段错误的提示，例如 request.signature is required。
     * MethodArgumentNotValidException 是 BindException 的子类。
     */
    private String resolveBadRequestMessage(Exception ex) {
        if (ex instanceof BindException) {
            FieldError fieldError = ((BindException) ex).getBindingResult().getFieldError();
            if (fieldError != null && StringUtils.isNotBlank(fieldError.getDefaultMessage())) {
                return fieldError.getDefaultMessage();
            }
        }
        if (ex instanceof HttpMessageNotReadableException) {
            return "request body is missing or malformed";
        }
        return StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo());
    }

    private String resolvePath(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-");
    }

    private String resolveMethod(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-");
    }

    private String resolveTraceId() {
        return StringUtils.defaultIfBlank(MDC.get("traceId"), "-");
    }

    private String resolveRequestId() {
        return StringUtils.defaultIfBlank(MDC.get("requestId"), "-");
    }

    private String truncate(String text, int maxLength) {
        if (StringUtils.isBlank(text) || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}

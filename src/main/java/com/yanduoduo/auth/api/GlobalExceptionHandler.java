package com.yanduoduo.auth.api;

import com.yanduoduo.auth.exception.BusinessException;
import com.yanduoduo.auth.exception.ErrorCode;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.Map;

/**
 * 统一错误响应，响应体为 `{code, message}`。
 * <p>
 * 业务异常与参数错误返回 400，未处理异常记录日志后返回 500。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<Map<String, Object>> handleBusiness(BusinessException ex) {
        log.info("Business failure code={} message={}", ex.getErrorCode().getCode(), ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage());
    }

    /**
     * 请求体校验失败，仅取首个字段错误作为提示。
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(FieldError::getDefaultMessage)
                .orElse(ErrorCode.INVALID_PARAM.getDefaultMessage());
        log.info("Invalid request body: {}", ex.getBindingResult().getFieldErrors());
        return body(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_PARAM, message);
    }

    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class,
            MissingServletRequestParameterException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleInvalidParam(Exception ex) {
        log.info("Invalid request parameter: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_PARAM, ErrorCode.INVALID_PARAM.getDefaultMessage());
    }

    /**
     * 上传文件缺失或解析失败（含超出大小限制）。
     */
    @ExceptionHandler({MissingServletRequestPartException.class, MultipartException.class})
    public ResponseEntity<Map<String, Object>> handleMultipart(Exception ex) {
        log.warn("Multipart request rejected: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ErrorCode.UPLOAD_ERROR, ex.getMessage());
    }

    /**
     * 路径、方法或内容类型不被支持，沿用框架给出的 404/405/415。
     */
    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<Map<String, Object>> handleUnsupported(Exception ex) {
        log.info("Unsupported request: {}", ex.getMessage());
        HttpStatusCode status = ex instanceof ErrorResponse errorResponse
                ? errorResponse.getStatusCode()
                : HttpStatus.BAD_REQUEST;
        return body(status, ErrorCode.INVALID_PARAM, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_ERROR, "服务异常，请稍后重试");
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatusCode status, ErrorCode errorCode, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("code", errorCode.getCode());
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}

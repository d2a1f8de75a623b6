package com.yanduoduo.auth.api;

import com.yanduoduo.auth.exception.BusinessException;
import com.yanduoduo.auth.exception.ErrorCode;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void businessErrorKeepsCodeAndMessage() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleBusiness(new BusinessException(ErrorCode.PASSWORD_ERROR));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody())
                .containsEntry("code", ErrorCode.PASSWORD_ERROR.getCode())
                .containsEntry("message", ErrorCode.PASSWORD_ERROR.getDefaultMessage());
    }

    @Test
    void missingParameterIsInvalidParam() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleInvalidParam(new MissingServletRequestParameterException("phone", "String"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("code", ErrorCode.INVALID_PARAM.getCode());
    }

    @Test
    void oversizedUploadIsUploadError() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleMultipart(new MaxUploadSizeExceededException(5L * 1024 * 1024));

        assertThat(response.getBody()).containsEntry("code", ErrorCode.UPLOAD_ERROR.getCode());
    }

    @Test
    void unsupportedMethodKeepsFrameworkStatus() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleUnsupported(new HttpRequestMethodNotSupportedException("GET"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
        assertThat(response.getBody()).containsEntry("code", ErrorCode.INVALID_PARAM.getCode());
    }

    @Test
    void unexpectedFailureIsInternalError() {
        ResponseEntity<Map<String, Object>> response = handler.handleGeneric(new IllegalStateException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody())
                .containsEntry("code", ErrorCode.INTERNAL_ERROR.getCode())
                .doesNotContainValue("boom");
    }
}

package com.yanduoduo.auth.exception;

import lombok.Getter;

@Getter
public enum ErrorCode {
    INVALID_PARAM("INVALID_PARAM", "请求参数错误"),
    PHONE_CODE_ERROR("PHONE_CODE_ERROR", "验证码错误"),
    PHONE_CODE_RATE_LIMIT("PHONE_CODE_RATE_LIMIT", "验证码发送过于频繁"),
    PHONE_CODE_DAILY_LIMIT("PHONE_CODE_DAILY_LIMIT", "验证码发送次数超限"),
    REGISTERED("REGISTERED", "该手机号已注册"),
    UNREGISTERED("UNREGISTERED", "该手机号未注册"),
    PASSWORD_ERROR("PASSWORD_ERROR", "密码错误"),
    TOKEN_INVALID("TOKEN_INVALID", "令牌无效"),
    TOKEN_EXPIRED("TOKEN_EXPIRED", "令牌已过期"),
    UPLOAD_ERROR("UPLOAD_ERROR", "上传失败"),
    INTERNAL_ERROR("INTERNAL_ERROR", "服务器内部错误");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }
}

package com.yanduoduo.auth.api.dto;

import com.yanduoduo.auth.util.IdentifierValidator;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * 注册请求，重置密码复用同一结构。
 * <p>
 * `password` 与 `rePassword` 必须一致，由业务层校验。
 */
public record RegisterRequest(
        @NotBlank(message = "手机号不能为空")
        @Pattern(regexp = IdentifierValidator.PHONE_REGEX, message = "手机号格式错误") String phone,
        @NotBlank(message = "验证码不能为空") String code,
        @NotBlank(message = "密码不能为空") String password,
        @NotBlank(message = "确认密码不能为空") String rePassword
) {
}

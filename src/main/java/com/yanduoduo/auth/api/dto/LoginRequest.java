package com.yanduoduo.auth.api.dto;

import com.yanduoduo.auth.util.IdentifierValidator;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * 登录请求。
 * <p>
 * 两种渠道二选一，同时提供时按密码登录：
 * - 密码登录：填写 `password`；
 * - 短信登录：填写 `code`。
 */
public record LoginRequest(
        @NotBlank(message = "手机号不能为空")
        @Pattern(regexp = IdentifierValidator.PHONE_REGEX, message = "手机号格式错误") String phone,
        String code,
        String password
) {
}

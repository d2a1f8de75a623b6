package com.yanduoduo.auth.api;

import com.yanduoduo.auth.api.dto.LoginRequest;
import com.yanduoduo.auth.api.dto.RegisterRequest;
import com.yanduoduo.auth.api.dto.RegisterResponse;
import com.yanduoduo.auth.api.dto.SendCodeResponse;
import com.yanduoduo.auth.api.dto.TokenResponse;
import com.yanduoduo.auth.model.ClientInfo;
import com.yanduoduo.auth.service.AuthService;
import com.yanduoduo.auth.token.JwtService;
import com.yanduoduo.auth.util.IdentifierValidator;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 账号 API 控制器。
 * <p>
 * 暴露 REST 接口：发送短信验证码、注册、登录、重置密码、刷新令牌、登出。
 * 参数格式由 Bean Validation 校验，失败统一返回 `INVALID_PARAM`。
 * 客户端信息：从请求头解析 IP 与 UA，用于登录审计。
 */
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Validated
public class AuthController {

    private final AuthService authService;
    private final JwtService jwtService;

    /**
     * 向手机号发送短信验证码。
     *
     * @param phone 手机号（查询参数）。
     * @return 手机号与验证码过期秒数。
     */
    @GetMapping("/phone-code")
    public SendCodeResponse sendPhoneCode(@RequestParam("phone") @NotBlank
                                          @Pattern(regexp = IdentifierValidator.PHONE_REGEX, message = "手机号格式错误") String phone) {
        return authService.sendPhoneCode(phone);
    }

    /**
     * 注册新用户。
     *
     * @param request     手机号、验证码、密码、确认密码。
     * @param httpRequest 用于解析客户端信息。
     * @return 新用户 ID 与昵称。
     */
    @PostMapping("/register")
    public RegisterResponse register(@Valid @RequestBody RegisterRequest request, HttpServletRequest httpRequest) {
        return authService.register(request, resolveClient(httpRequest));
    }

    /**
     * 密码或短信验证码登录。
     *
     * @param request     手机号，以及密码或验证码。
     * @param httpRequest 用于解析客户端信息。
     * @return 访问令牌与会话令牌。
     */
    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        return authService.login(request, resolveClient(httpRequest));
    }

    /**
     * 使用验证码重置密码。
     *
     * @param request 与注册相同的请求结构。
     * @return HTTP 204。
     */
    @PostMapping("/password/reset")
    public ResponseEntity<Void> resetPassword(@Valid @RequestBody RegisterRequest request) {
        authService.resetPassword(request);
        return ResponseEntity.noContent().build();
    }

    /**
     * 使用会话令牌换取新的令牌。
     *
     * @param token 会话令牌（查询参数）；缺失时返回 `TOKEN_INVALID`。
     * @return 新的令牌响应。
     */
    @PostMapping("/token/refresh")
    public TokenResponse refresh(@RequestParam(value = "token", required = false) String token) {
        return authService.refresh(token);
    }

    /**
     * 退出登录，清除当前用户的会话令牌。
     *
     * @param jwt 当前请求的访问令牌。
     * @return HTTP 204。
     */
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@AuthenticationPrincipal Jwt jwt) {
        authService.logout(jwtService.extractUserId(jwt));
        return ResponseEntity.noContent().build();
    }

    private ClientInfo resolveClient(HttpServletRequest request) {
        return new ClientInfo(extractClientIp(request), request.getHeader("User-Agent"));
    }

    /**
     * 提取客户端 IP：优先 `X-Forwarded-For`（取第一个）、其次 `X-Real-IP`，否则取远端地址。
     */
    private String extractClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return request.getRemoteAddr();
    }
}

package com.yanduoduo.auth.service;

import com.yanduoduo.auth.api.dto.LoginRequest;
import com.yanduoduo.auth.api.dto.RegisterRequest;
import com.yanduoduo.auth.api.dto.RegisterResponse;
import com.yanduoduo.auth.api.dto.SendCodeResponse;
import com.yanduoduo.auth.api.dto.TokenResponse;
import com.yanduoduo.auth.audit.LoginLogService;
import com.yanduoduo.auth.exception.BusinessException;
import com.yanduoduo.auth.exception.ErrorCode;
import com.yanduoduo.auth.model.ClientInfo;
import com.yanduoduo.auth.password.SaltedPassword;
import com.yanduoduo.auth.password.SaltedPasswordEncoder;
import com.yanduoduo.auth.token.SessionTokenService;
import com.yanduoduo.auth.token.TokenPair;
import com.yanduoduo.auth.verification.SendCodeResult;
import com.yanduoduo.auth.verification.VerificationCheckResult;
import com.yanduoduo.auth.verification.VerificationCodeStatus;
import com.yanduoduo.auth.verification.VerificationService;
import com.yanduoduo.user.domain.User;
import com.yanduoduo.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Objects;
import java.util.UUID;

/**
 * 账号认证业务服务。
 * <p>
 * 职责：发送短信验证码、注册、登录（密码/短信）、重置密码、刷新令牌、登出。
 * 规则：
 * - 注册与重置密码要求两次输入的密码一致；
 * - 注册先校验验证码，再检查手机号是否已注册；重置密码与登录先检查手机号是否已注册；
 * - 验证码校验成功即失效；
 * - 每个用户同一时间只有一个会话令牌。
 * 审计：注册、登录成功以及密码或验证码错误写入登录日志。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserService userService;
    private final VerificationService verificationService;
    private final SaltedPasswordEncoder passwordEncoder;
    private final SessionTokenService sessionTokenService;
    private final LoginLogService loginLogService;

    /**
     * 发送短信验证码。
     *
     * @param phone 手机号。
     * @return 手机号与验证码过期秒数。
     */
    public SendCodeResponse sendPhoneCode(String phone) {
        SendCodeResult result = verificationService.sendCode(phone.trim());
        return new SendCodeResponse(result.phone(), result.expireSeconds());
    }

    /**
     * 注册新用户。
     *
     * @param request    注册请求：手机号、验证码、密码、确认密码。
     * @param clientInfo 客户端信息，用于审计。
     * @return 新用户的 ID 与昵称。
     * @throws BusinessException 密码不一致（INVALID_PARAM）、验证码错误（PHONE_CODE_ERROR）、已注册（REGISTERED）。
     */
    public RegisterResponse register(RegisterRequest request, ClientInfo clientInfo) {
        ensurePasswordsMatch(request);
        String phone = request.phone().trim();
        ensureCodeCorrect(phone, request.code());
        if (userService.existsByPhone(phone)) {
            throw new BusinessException(ErrorCode.REGISTERED);
        }

        SaltedPassword salted = passwordEncoder.encode(request.password());
        User user = User.builder()
                .phone(phone)
                .passwordSalt(salted.salt())
                .passwordHash(salted.hash())
                .nickname(generateNickname())
                .build();
        userService.createUser(user);
        loginLogService.record(user.getId(), phone, LoginLogService.CHANNEL_REGISTER, clientInfo, LoginLogService.STATUS_SUCCESS);
        log.info("用户 {} 创建成功，id 为 {}", user.getNickname(), user.getId());
        return new RegisterResponse(user.getId(), user.getNickname());
    }

    /**
     * 登录并签发会话。
     *
     * @param request    登录请求：手机号，以及密码或验证码。
     * @param clientInfo 客户端信息，用于审计。
     * @return 令牌响应。
     * @throws BusinessException 未注册（UNREGISTERED）、密码错误（PASSWORD_ERROR）、验证码错误（PHONE_CODE_ERROR）、
     *                           未提供凭证（INVALID_PARAM）。
     */
    public TokenResponse login(LoginRequest request, ClientInfo clientInfo) {
        String phone = request.phone().trim();
        User user = userService.findByPhone(phone)
                .orElseThrow(() -> new BusinessException(ErrorCode.UNREGISTERED));
        String channel;
        if (StringUtils.hasText(request.password())) {
            channel = LoginLogService.CHANNEL_PASSWORD;
            if (!passwordEncoder.matches(user, request.password())) {
                loginLogService.record(user.getId(), phone, channel, clientInfo, LoginLogService.STATUS_FAILED);
                log.warn("用户 {} 密码错误", user.getId());
                throw new BusinessException(ErrorCode.PASSWORD_ERROR);
            }
        } else if (StringUtils.hasText(request.code())) {
            channel = LoginLogService.CHANNEL_CODE;
            VerificationCheckResult result = verificationService.verify(phone, request.code());
            if (!result.isSuccess()) {
                loginLogService.record(user.getId(), phone, channel, clientInfo, LoginLogService.STATUS_FAILED);
                log.warn("用户 {} 验证码校验失败 status={}", user.getId(), result.status());
                throw codeError(result);
            }
        } else {
            throw new BusinessException(ErrorCode.INVALID_PARAM, "请提供密码或验证码");
        }

        TokenPair tokenPair = sessionTokenService.issue(user);
        loginLogService.record(user.getId(), phone, channel, clientInfo, LoginLogService.STATUS_SUCCESS);
        log.info("用户 {} 登陆成功", user.getId());
        return toTokenResponse(tokenPair);
    }

    /**
     * 使用验证码重置密码，生成新的盐与哈希。
     *
     * @param request 与注册相同的请求结构。
     * @throws BusinessException 密码不一致（INVALID_PARAM）、未注册（UNREGISTERED）、验证码错误（PHONE_CODE_ERROR）。
     */
    public void resetPassword(RegisterRequest request) {
        ensurePasswordsMatch(request);
        String phone = request.phone().trim();
        User user = userService.findByPhone(phone)
                .orElseThrow(() -> new BusinessException(ErrorCode.UNREGISTERED));
        ensureCodeCorrect(phone, request.code());

        SaltedPassword salted = passwordEncoder.encode(request.password());
        user.setPasswordSalt(salted.salt());
        user.setPasswordHash(salted.hash());
        userService.updatePassword(user);
        log.info("用户 {} 修改密码", user.getId());
    }

    /**
     * 刷新令牌。
     *
     * @param sessionToken 会话令牌。
     * @return 新的令牌响应。
     * @throws BusinessException 令牌无效（TOKEN_INVALID）或过期（TOKEN_EXPIRED）。
     */
    public TokenResponse refresh(String sessionToken) {
        TokenPair tokenPair = sessionTokenService.refresh(sessionToken);
        return toTokenResponse(tokenPair);
    }

    /**
     * 登出：清除会话令牌。
     *
     * @param userId 当前用户 ID。
     */
    public void logout(long userId) {
        sessionTokenService.clear(userId);
        log.info("用户 {} 退出登录", userId);
    }

    private void ensurePasswordsMatch(RegisterRequest request) {
        if (!Objects.equals(request.password(), request.rePassword())) {
            throw new BusinessException(ErrorCode.INVALID_PARAM, "两次输入的密码不一致");
        }
    }

    private void ensureCodeCorrect(String phone, String code) {
        VerificationCheckResult result = verificationService.verify(phone, code);
        if (!result.isSuccess()) {
            throw codeError(result);
        }
    }

    /**
     * 按校验状态给出提示，错误码统一为 PHONE_CODE_ERROR。
     */
    private static BusinessException codeError(VerificationCheckResult result) {
        VerificationCodeStatus status = result.status();
        if (status == VerificationCodeStatus.NOT_FOUND) {
            return new BusinessException(ErrorCode.PHONE_CODE_ERROR, "验证码不存在或已过期");
        }
        if (status == VerificationCodeStatus.TOO_MANY_ATTEMPTS) {
            return new BusinessException(ErrorCode.PHONE_CODE_ERROR, "验证码尝试次数过多");
        }
        return new BusinessException(ErrorCode.PHONE_CODE_ERROR,
                "验证码错误，还可尝试 " + result.remainingAttempts() + " 次");
    }

    private TokenResponse toTokenResponse(TokenPair tokenPair) {
        return new TokenResponse(tokenPair.userId(), tokenPair.accessToken(), tokenPair.accessTokenExpiresAt(),
                tokenPair.sessionToken(), tokenPair.sessionTokenExpiresAt());
    }

    private String generateNickname() {
        return "研多多用户" + UUID.randomUUID().toString().substring(0, 8);
    }
}

package com.yanduoduo.auth.token;

import com.yanduoduo.auth.exception.BusinessException;
import com.yanduoduo.auth.exception.ErrorCode;
import com.yanduoduo.user.domain.User;
import com.yanduoduo.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;

/**
 * 会话令牌管理。
 * <p>
 * 每个用户同时只有一个会话令牌，存放在用户记录的 `token` / `token_expires_at` 字段：
 * 登录与刷新时覆盖，登出时清空。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionTokenService {

    private final JwtService jwtService;
    private final UserService userService;
    private final Clock clock;

    /**
     * 为用户签发新会话，旧会话令牌随之失效。
     *
     * @param user 用户实体（需包含 ID）。
     * @return 新的令牌对。
     */
    public TokenPair issue(User user) {
        TokenPair tokenPair = jwtService.issueTokenPair(user);
        userService.updateToken(user.getId(), tokenPair.sessionToken(), tokenPair.sessionTokenExpiresAt());
        user.setToken(tokenPair.sessionToken());
        user.setTokenExpiresAt(tokenPair.sessionTokenExpiresAt());
        return tokenPair;
    }

    /**
     * 使用会话令牌换取新的令牌对。
     *
     * @param sessionToken 客户端持有的会话令牌。
     * @return 新的令牌对。
     * @throws BusinessException 令牌缺失或不存在时为 {@code TOKEN_INVALID}，已过期时为 {@code TOKEN_EXPIRED}。
     */
    public TokenPair refresh(String sessionToken) {
        if (!StringUtils.hasText(sessionToken)) {
            throw new BusinessException(ErrorCode.TOKEN_INVALID);
        }
        log.info("刷新 token");
        User user = userService.findByToken(sessionToken.trim())
                .orElseThrow(() -> new BusinessException(ErrorCode.TOKEN_INVALID));
        if (isExpired(user.getTokenExpiresAt())) {
            throw new BusinessException(ErrorCode.TOKEN_EXPIRED);
        }
        TokenPair tokenPair = issue(user);
        log.info("用户 {} 刷新 token 成功", user.getId());
        return tokenPair;
    }

    /**
     * 清除用户当前会话。
     *
     * @param userId 用户 ID。
     */
    public void clear(long userId) {
        userService.updateToken(userId, null, null);
    }

    private boolean isExpired(Instant expiresAt) {
        return expiresAt == null || !Instant.now(clock).isBefore(expiresAt);
    }
}

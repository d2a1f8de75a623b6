package com.yanduoduo.auth.api.dto;

import java.time.Instant;

/**
 * 令牌响应。
 * <p>
 * `accessToken` 用于访问需要登录的接口；`token` 为会话令牌，过期前可用于刷新。
 */
public record TokenResponse(
        Long userId,
        String accessToken,
        Instant accessTokenExpiresAt,
        String token,
        Instant tokenExpiresAt
) {
}

package com.yanduoduo.auth.token;

import java.time.Instant;

/**
 * 一次登录会话签发的令牌。
 * <p>
 * - userId：令牌所属用户；
 * - accessToken：访问令牌（RS256 JWT，`Authorization: Bearer` 使用）；
 * - sessionToken：不透明的会话令牌，保存在用户记录上，仅用于刷新。
 */
public record TokenPair(
        long userId,
        String accessToken,
        Instant accessTokenExpiresAt,
        String sessionToken,
        Instant sessionTokenExpiresAt
) {
}

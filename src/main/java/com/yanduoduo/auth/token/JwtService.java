package com.yanduoduo.auth.token;

import com.yanduoduo.auth.config.AuthProperties;
import com.yanduoduo.user.domain.User;
import lombok.RequiredArgsConstructor;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;

/**
 * 令牌签发服务。
 * <p>
 * 访问令牌为 RS256 JWT，声明：
 * - `token_type`：固定为 access；
 * - `uid`：用户 ID；
 * - `jti`：令牌 ID。
 * 会话令牌为 32 字节随机数的 URL 安全 Base64，不携带任何用户信息。
 */
@Service
@RequiredArgsConstructor
public class JwtService {

    private static final String CLAIM_TOKEN_TYPE = "token_type";
    private static final String CLAIM_USER_ID = "uid";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final JwtEncoder jwtEncoder;
    private final AuthProperties properties;
    private final Clock clock;

    /**
     * 为用户签发访问令牌与新的会话令牌。
     *
     * @param user 用户实体。
     * @return 令牌对与各自的过期时间。
     */
    public TokenPair issueTokenPair(User user) {
        Instant issuedAt = Instant.now(clock);
        Instant accessExpiresAt = issuedAt.plus(properties.getJwt().getAccessTokenTtl());
        Instant sessionExpiresAt = issuedAt.plus(properties.getJwt().getSessionTokenTtl());
        String accessToken = encodeAccessToken(user, issuedAt, accessExpiresAt);
        return new TokenPair(user.getId(), accessToken, accessExpiresAt, generateSessionToken(), sessionExpiresAt);
    }

    /**
     * 从 JWT 中提取用户 ID。
     *
     * @param jwt 已解析的 JWT。
     * @return 用户 ID。
     * @throws IllegalArgumentException 当声明缺失或类型不合法时抛出。
     */
    public long extractUserId(Jwt jwt) {
        Object claim = jwt.getClaims().get(CLAIM_USER_ID);
        if (claim instanceof Number number) {
            return number.longValue();
        }
        if (claim instanceof String text) {
            return Long.parseLong(text);
        }
        throw new IllegalArgumentException("Invalid user id in token");
    }

    private String encodeAccessToken(User user, Instant issuedAt, Instant expiresAt) {
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .issuer(properties.getJwt().getIssuer())
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .subject(String.valueOf(user.getId()))
                .id(UUID.randomUUID().toString())
                .claim(CLAIM_TOKEN_TYPE, "access")
                .claim(CLAIM_USER_ID, user.getId())
                .build();
        return jwtEncoder.encode(JwtEncoderParameters.from(claims)).getTokenValue();
    }

    private static String generateSessionToken() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}

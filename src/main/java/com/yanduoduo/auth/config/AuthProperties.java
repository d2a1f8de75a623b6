package com.yanduoduo.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;

import java.time.Duration;

/**
 * 认证相关配置属性，绑定前缀 {@code auth.*}。
 *
 * <p>包含以下分组：</p>
 * - Jwt：访问令牌签发与会话令牌有效期；
 * - Verification：短信验证码发送与校验；
 * - Password：密码哈希强度。
 */
@Data
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    /** 令牌配置项。 */
    private final Jwt jwt = new Jwt();
    /** 验证码配置项。 */
    private final Verification verification = new Verification();
    /** 密码配置项。 */
    private final Password password = new Password();

    @Data
    public static class Jwt {
        /** JWT 签发者标识（iss）。 */
        private String issuer = "yanduoduo";
        /** 访问令牌有效期。 */
        private Duration accessTokenTtl = Duration.ofMinutes(30);
        /** 会话令牌（用于刷新）有效期。 */
        private Duration sessionTokenTtl = Duration.ofDays(7);
        /** JWK 密钥标识（kid）。 */
        private String keyId = "yanduoduo-key";
        /** RSA 私钥 PEM（PKCS#8）资源。 */
        private Resource privateKey;
        /** RSA 公钥 PEM（X.509）资源。 */
        private Resource publicKey;
    }

    /**
     * 短信验证码配置：位数、有效期、最大尝试次数、发送间隔与每日上限。
     */
    @Data
    public static class Verification {
        private int codeLength = 6;
        private Duration ttl = Duration.ofMinutes(5);
        private int maxAttempts = 5;
        /** 同一手机号连续发送的最小间隔，0 表示不限制。 */
        private Duration sendInterval = Duration.ofSeconds(60);
        /** 同一手机号每日发送上限，0 表示不限制。 */
        private int dailyLimit = 10;
    }

    @Data
    public static class Password {
        /** BCrypt cost。 */
        private int bcryptStrength = 10;
    }
}

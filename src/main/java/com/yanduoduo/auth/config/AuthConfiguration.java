package com.yanduoduo.auth.config;

import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimValidator;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import java.security.interfaces.RSAPublicKey;
import java.time.Clock;

/**
 * 认证相关 Bean。
 * <p>
 * 访问令牌使用 RS256 签名；解码时除签名与有效期外，还校验签发方与 `token_type=access`，
 * 会话令牌是不透明字符串，不经过这里。
 */
@Configuration
@EnableConfigurationProperties(AuthProperties.class)
@RequiredArgsConstructor
public class AuthConfiguration {

    private static final String ACCESS_TOKEN_TYPE = "access";

    private final AuthProperties properties;

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(properties.getPassword().getBcryptStrength());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JwtEncoder jwtEncoder() {
        AuthProperties.Jwt jwt = properties.getJwt();
        RSAKey signingKey = new RSAKey.Builder(PemUtils.readPublicKey(jwt.getPublicKey()))
                .privateKey(PemUtils.readPrivateKey(jwt.getPrivateKey()))
                .keyID(jwt.getKeyId())
                .build();
        return new NimbusJwtEncoder(new ImmutableJWKSet<>(new JWKSet(signingKey)));
    }

    /**
     * 资源服务器校验 `Authorization: Bearer` 时使用的解码器。
     */
    @Bean
    public JwtDecoder jwtDecoder() {
        RSAPublicKey publicKey = PemUtils.readPublicKey(properties.getJwt().getPublicKey());
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withPublicKey(publicKey).build();
        decoder.setJwtValidator(accessTokenValidator());
        return decoder;
    }

    private OAuth2TokenValidator<Jwt> accessTokenValidator() {
        OAuth2TokenValidator<Jwt> tokenType =
                new JwtClaimValidator<String>("token_type", ACCESS_TOKEN_TYPE::equals);
        return new DelegatingOAuth2TokenValidator<>(
                JwtValidators.createDefaultWithIssuer(properties.getJwt().getIssuer()), tokenType);
    }
}

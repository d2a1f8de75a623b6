package com.yanduoduo.auth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yanduoduo.auth.exception.ErrorCode;
import com.yanduoduo.storage.config.AvatarStorageProperties;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * 无状态 API 的安全配置。
 * <p>
 * 获取验证码、注册、登录、重置密码、刷新令牌以及头像文件无需登录；
 * 资料、上传头像与登出需要访问令牌，缺失或无效时返回 401 与 `{code, message}`。
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private static final String[] PUBLIC_AUTH_ENDPOINTS = {
            "/api/v1/auth/phone-code",
            "/api/v1/auth/register",
            "/api/v1/auth/login",
            "/api/v1/auth/password/reset",
            "/api/v1/auth/token/refresh"
    };

    private final ObjectMapper objectMapper;
    private final AvatarStorageProperties avatarProperties;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .cors(Customizer.withDefaults())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(PUBLIC_AUTH_ENDPOINTS).permitAll()
                        .requestMatchers(HttpMethod.GET, avatarProperties.resourcePattern()).permitAll()
                        .requestMatchers("/actuator/health", "/actuator/info").permitAll()
                        .anyRequest().authenticated()
                )
                .oauth2ResourceServer(oauth -> oauth
                        .jwt(Customizer.withDefaults())
                        .authenticationEntryPoint(tokenInvalidEntryPoint()))
                .exceptionHandling(ex -> ex.authenticationEntryPoint(tokenInvalidEntryPoint()));
        return http.build();
    }

    /**
     * 未认证请求统一返回 TOKEN_INVALID，与业务错误的响应体保持一致。
     */
    private AuthenticationEntryPoint tokenInvalidEntryPoint() {
        return (request, response, authException) -> {
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            objectMapper.writeValue(response.getOutputStream(), Map.of(
                    "code", ErrorCode.TOKEN_INVALID.getCode(),
                    "message", ErrorCode.TOKEN_INVALID.getDefaultMessage()));
        };
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration cors = new CorsConfiguration();
        cors.setAllowedOriginPatterns(List.of("*"));
        cors.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
        cors.setAllowedHeaders(List.of("Authorization", "Content-Type"));
        cors.setMaxAge(3600L);
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/**", cors);
        return source;
    }
}

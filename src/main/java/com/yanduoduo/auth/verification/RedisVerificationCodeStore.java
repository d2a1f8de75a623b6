package com.yanduoduo.auth.verification;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * 基于 Redis 的验证码存储。
 * <p>
 * 验证码使用 Hash 保存 `code`、`maxAttempts` 与 `attempts`，TTL 控制有效期，键为 `auth:code:{phone}`。
 * 发送间隔键 `auth:code:last:{phone}`，每日计数键 `auth:code:count:{phone}:{yyyyMMdd}`。
 */
@Component
public class RedisVerificationCodeStore implements VerificationCodeStore {

    private static final String FIELD_CODE = "code";
    private static final String FIELD_MAX_ATTEMPTS = "maxAttempts";
    private static final String FIELD_ATTEMPTS = "attempts";
    private static final Duration LOCK_AFTER_TOO_MANY_ATTEMPTS = Duration.ofMinutes(30);
    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

    private static final String VERIFY_LUA = """
            local key = KEYS[1]
            if redis.call('EXISTS', key) == 0 then
              return {0, 0, 0}
            end
            local stored = redis.call('HGET', key, 'code')
            local max = tonumber(redis.call('HGET', key, 'maxAttempts') or '5')
            local attempts = tonumber(redis.call('HGET', key, 'attempts') or '0')
            if attempts >= max then
              return {3, attempts, max}
            end
            if stored == ARGV[1] then
              redis.call('DEL', key)
              return {1, attempts, max}
            end
            attempts = redis.call('HINCRBY', key, 'attempts', 1)
            if attempts >= max then
              redis.call('EXPIRE', key, tonumber(ARGV[2]))
              return {3, attempts, max}
            end
            return {2, attempts, max}
            """;

    private final StringRedisTemplate redisTemplate;
    @SuppressWarnings("rawtypes")
    private final DefaultRedisScript<List> verifyScript;

    public RedisVerificationCodeStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        // 返回 {状态, 尝试次数, 最大次数}；状态 0 未找到、1 成功、2 不匹配、3 已锁定
        this.verifyScript = new DefaultRedisScript<>(VERIFY_LUA, List.class);
    }

    @Override
    public void saveCode(String phone, String code, Duration ttl, int maxAttempts) {
        String key = codeKey(phone);
        HashOperations<String, String, String> ops = redisTemplate.opsForHash();
        try {
            ops.putAll(key, Map.of(
                    FIELD_CODE, code,
                    FIELD_MAX_ATTEMPTS, String.valueOf(maxAttempts),
                    FIELD_ATTEMPTS, "0"));
            redisTemplate.expire(key, ttl);
        } catch (DataAccessException ex) {
            throw new RedisSystemException("Failed to save phone code", ex);
        }
    }

    /**
     * 校验验证码；超过最大尝试次数后锁定该验证码 30 分钟。
     * <p>
     * 读取、比对、计数与锁定在同一个脚本中完成，键不存在时不会被重新创建。
     */
    @Override
    public VerificationCheckResult verify(String phone, String code) {
        List<?> result = redisTemplate.execute(verifyScript, List.of(codeKey(phone)),
                code, String.valueOf(LOCK_AFTER_TOO_MANY_ATTEMPTS.toSeconds()));
        if (result == null || result.size() < 3) {
            return new VerificationCheckResult(VerificationCodeStatus.NOT_FOUND, 0, 0);
        }
        VerificationCodeStatus status = switch (toInt(result.get(0))) {
            case 1 -> VerificationCodeStatus.SUCCESS;
            case 2 -> VerificationCodeStatus.MISMATCH;
            case 3 -> VerificationCodeStatus.TOO_MANY_ATTEMPTS;
            default -> VerificationCodeStatus.NOT_FOUND;
        };
        return new VerificationCheckResult(status, toInt(result.get(1)), toInt(result.get(2)));
    }

    @Override
    public boolean tryMarkSent(String phone, Duration interval) {
        Boolean marked = redisTemplate.opsForValue().setIfAbsent("auth:code:last:" + phone, "1", interval);
        return Boolean.TRUE.equals(marked);
    }

    @Override
    public long incrementDailyCount(String phone, LocalDate day) {
        String key = "auth:code:count:" + phone + ":" + DAY_FORMAT.format(day);
        Long count = redisTemplate.opsForValue().increment(key);
        if (count != null && count == 1L) {
            redisTemplate.expire(key, Duration.ofDays(1));
        }
        return count != null ? count : 0L;
    }

    private static String codeKey(String phone) {
        return "auth:code:" + phone;
    }

    private static int toInt(Object value) {
        return value instanceof Number number ? number.intValue() : 0;
    }
}

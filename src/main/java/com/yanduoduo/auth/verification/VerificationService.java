package com.yanduoduo.auth.verification;

import com.yanduoduo.auth.config.AuthProperties;
import com.yanduoduo.auth.exception.BusinessException;
import com.yanduoduo.auth.exception.ErrorCode;
import com.yanduoduo.auth.util.IdentifierValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;

/**
 * 短信验证码业务服务。
 * <p>
 * 负责发送与校验验证码：
 * - 发送间隔与每日限额；
 * - 随机数字码生成与存储；
 * - 调用 {@link CodeSender} 实际发送。
 * 配置来源于 `AuthProperties.Verification`。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationService {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final VerificationCodeStore codeStore;
    private final CodeSender codeSender;
    private final AuthProperties properties;
    private final Clock clock;

    /**
     * 向手机号发送验证码。
     *
     * @param phone 手机号。
     * @return 发送结果，包含手机号与过期秒数。
     * @throws BusinessException 手机号不合法或触发频率/日限额时抛出。
     */
    public SendCodeResult sendCode(String phone) {
        if (!IdentifierValidator.isValidPhone(phone)) {
            throw new BusinessException(ErrorCode.INVALID_PARAM, "手机号格式错误");
        }
        AuthProperties.Verification cfg = properties.getVerification();
        enforceSendInterval(phone, cfg.getSendInterval());
        enforceDailyLimit(phone, cfg.getDailyLimit());

        String code = generateNumericCode(cfg.getCodeLength());
        codeStore.saveCode(phone, code, cfg.getTtl(), cfg.getMaxAttempts());
        codeSender.sendCode(phone, code, (int) cfg.getTtl().toMinutes());
        log.info("成功发送验证码 phone={}", phone);
        return new SendCodeResult(phone, (int) cfg.getTtl().toSeconds());
    }

    /**
     * 校验验证码。参数不完整时视为未找到，不抛异常。
     *
     * @param phone 手机号。
     * @param code  用户输入的验证码。
     * @return 校验结果。
     */
    public VerificationCheckResult verify(String phone, String code) {
        if (!StringUtils.hasText(phone) || !StringUtils.hasText(code)) {
            return new VerificationCheckResult(VerificationCodeStatus.NOT_FOUND, 0, 0);
        }
        return codeStore.verify(phone, code.trim());
    }

    private void enforceSendInterval(String phone, Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            return;
        }
        if (!codeStore.tryMarkSent(phone, interval)) {
            throw new BusinessException(ErrorCode.PHONE_CODE_RATE_LIMIT);
        }
    }

    private void enforceDailyLimit(String phone, int limit) {
        if (limit <= 0) {
            return;
        }
        long count = codeStore.incrementDailyCount(phone, LocalDate.now(clock));
        if (count > limit) {
            throw new BusinessException(ErrorCode.PHONE_CODE_DAILY_LIMIT);
        }
    }

    private static String generateNumericCode(int length) {
        StringBuilder builder = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            builder.append(RANDOM.nextInt(10));
        }
        return builder.toString();
    }
}

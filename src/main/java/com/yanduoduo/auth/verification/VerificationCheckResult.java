package com.yanduoduo.auth.verification;

/**
 * 一次验证码校验的结论；`attempts` 为本次校验后的累计失败次数。
 */
public record VerificationCheckResult(VerificationCodeStatus status, int attempts, int maxAttempts) {

    public boolean isSuccess() {
        return status == VerificationCodeStatus.SUCCESS;
    }

    public int remainingAttempts() {
        return Math.max(0, maxAttempts - attempts);
    }
}

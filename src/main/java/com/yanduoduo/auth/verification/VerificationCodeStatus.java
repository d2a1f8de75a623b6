package com.yanduoduo.auth.verification;

public enum VerificationCodeStatus {
    SUCCESS,
    NOT_FOUND,
    MISMATCH,
    TOO_MANY_ATTEMPTS
}

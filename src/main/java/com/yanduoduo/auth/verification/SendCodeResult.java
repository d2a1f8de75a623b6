package com.yanduoduo.auth.verification;

/**
 * 发送验证码结果：目标手机号与验证码有效期（秒）。
 */
public record SendCodeResult(String phone, int expireSeconds) {
}

package com.yanduoduo.auth.api.dto;

/**
 * 发送验证码响应：手机号与验证码有效期（秒）。
 */
public record SendCodeResponse(String phone, int expireSeconds) {
}

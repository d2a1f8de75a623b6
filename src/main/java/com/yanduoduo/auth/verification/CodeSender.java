package com.yanduoduo.auth.verification;

/**
 * 短信验证码发送器。
 * <p>
 * 抽象真实的短信通道，生产环境替换为短信服务商实现。
 */
public interface CodeSender {

    /**
     * 发送验证码到指定手机号。
     *
     * @param phone         手机号。
     * @param code          验证码内容。
     * @param expireMinutes 验证码有效期（分钟）。
     */
    void sendCode(String phone, String code, int expireMinutes);
}

package com.yanduoduo.auth.verification;

import java.time.Duration;
import java.time.LocalDate;

/**
 * 短信验证码存储接口。
 * <p>
 * 负责验证码的保存与校验，以及发送频率控制所需的计数。
 * 实现需支持 TTL 与最大尝试次数。
 */
public interface VerificationCodeStore {

    /**
     * 保存验证码，覆盖该手机号尚未使用的旧验证码。
     *
     * @param phone       手机号。
     * @param code        验证码。
     * @param ttl         有效期。
     * @param maxAttempts 最大尝试次数。
     */
    void saveCode(String phone, String code, Duration ttl, int maxAttempts);

    /**
     * 校验验证码；成功后验证码即失效，失败则累加尝试次数。
     *
     * @param phone 手机号。
     * @param code  用户输入的验证码。
     * @return 校验结果。
     */
    VerificationCheckResult verify(String phone, String code);

    /**
     * 占用发送间隔窗口。
     *
     * @param phone    手机号。
     * @param interval 间隔。
     * @return 窗口内首次发送返回 true；窗口未结束返回 false。
     */
    boolean tryMarkSent(String phone, Duration interval);

    /**
     * 当日发送计数加一。
     *
     * @param phone 手机号。
     * @param day   日期。
     * @return 加一后的当日计数。
     */
    long incrementDailyCount(String phone, LocalDate day);
}

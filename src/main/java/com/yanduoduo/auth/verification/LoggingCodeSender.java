package com.yanduoduo.auth.verification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 未接入短信网关时的默认实现，验证码只出现在日志中。
 */
@Slf4j
@Component
public class LoggingCodeSender implements CodeSender {

    @Override
    public void sendCode(String phone, String code, int expireMinutes) {
        log.info("短信验证码 phone={} code={}，{} 分钟内有效", phone, code, expireMinutes);
    }
}

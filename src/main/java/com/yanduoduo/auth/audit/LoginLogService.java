package com.yanduoduo.auth.audit;

import com.yanduoduo.auth.model.ClientInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * 登录审计。记录注册、登录的成功与失败，写库失败只记日志，不影响主流程。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginLogService {

    public static final String CHANNEL_PASSWORD = "PASSWORD";
    public static final String CHANNEL_CODE = "CODE";
    public static final String CHANNEL_REGISTER = "REGISTER";
    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_FAILED = "FAILED";

    private final LoginLogMapper loginLogMapper;
    private final Clock clock;

    /**
     * 记录一次登录/注册事件。
     *
     * @param userId     用户 ID。
     * @param phone      使用的手机号。
     * @param channel    渠道：PASSWORD/CODE/REGISTER。
     * @param clientInfo 客户端 IP 与 UA。
     * @param status     结果：SUCCESS/FAILED。
     */
    public void record(Long userId, String phone, String channel, ClientInfo clientInfo, String status) {
        LoginLog entry = LoginLog.builder()
                .userId(userId)
                .phone(phone)
                .channel(channel)
                .ip(clientInfo.ip())
                .userAgent(clientInfo.userAgent())
                .status(status)
                .createdAt(Instant.now(clock))
                .build();
        try {
            loginLogMapper.insert(entry);
        } catch (DataAccessException ex) {
            log.warn("Failed to record login log userId={} channel={} status={}", userId, channel, status, ex);
        }
    }
}

package com.yanduoduo.user.service;

import com.yanduoduo.user.domain.User;

import java.time.Instant;
import java.util.Optional;

/**
 * 用户领域服务接口。
 */
public interface UserService {

    Optional<User> findByPhone(String phone);

    Optional<User> findById(long id);

    Optional<User> findByToken(String token);

    boolean existsByPhone(String phone);

    /**
     * 创建用户。
     *
     * @throws com.yanduoduo.auth.exception.BusinessException 手机号已被占用（唯一索引冲突）时抛出 {@code REGISTERED}。
     */
    User createUser(User user);

    void updatePassword(User user);

    void updateAvatar(long userId, String avatar);

    /**
     * 写入会话令牌；{@code token} 为空表示清除会话。
     */
    void updateToken(long userId, String token, Instant expiresAt);
}

package com.yanduoduo.user.service.impl;

import com.yanduoduo.auth.exception.BusinessException;
import com.yanduoduo.auth.exception.ErrorCode;
import com.yanduoduo.user.domain.User;
import com.yanduoduo.user.mapper.UserMapper;
import com.yanduoduo.user.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserService {

    private final UserMapper userMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findByPhone(String phone) {
        return Optional.ofNullable(userMapper.findByPhone(phone));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findById(long id) {
        return Optional.ofNullable(userMapper.findById(id));
    }

    /**
     * 根据会话令牌查询用户。
     *
     * @param token 会话令牌。
     * @return 用户 Optional；令牌为空时直接返回空。
     */
    @Override
    @Transactional(readOnly = true)
    public Optional<User> findByToken(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        return Optional.ofNullable(userMapper.findByToken(token));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByPhone(String phone) {
        return userMapper.existsByPhone(phone);
    }

    /**
     * 创建用户，写入创建与更新时间并持久化。
     * <p>
     * 并发注册同一手机号时由唯一索引兜底，冲突转换为 {@link ErrorCode#REGISTERED}。
     *
     * @param user 待创建的用户实体。
     * @return 回填了 ID 的用户实体。
     */
    @Override
    @Transactional
    public User createUser(User user) {
        Instant now = Instant.now(clock);
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        try {
            userMapper.insert(user);
        } catch (DuplicateKeyException ex) {
            throw new BusinessException(ErrorCode.REGISTERED, ErrorCode.REGISTERED.getDefaultMessage(), ex);
        }
        return user;
    }

    /**
     * 更新密码哈希与盐。
     *
     * @param user 用户实体（需包含 ID、passwordHash 与 passwordSalt）。
     */
    @Override
    @Transactional
    public void updatePassword(User user) {
        Instant now = Instant.now(clock);
        user.setUpdatedAt(now);
        userMapper.updatePassword(user.getId(), user.getPasswordHash(), user.getPasswordSalt(), now);
    }

    @Override
    @Transactional
    public void updateAvatar(long userId, String avatar) {
        userMapper.updateAvatar(userId, avatar, Instant.now(clock));
    }

    @Override
    @Transactional
    public void updateToken(long userId, String token, Instant expiresAt) {
        userMapper.updateToken(userId, token, expiresAt, Instant.now(clock));
    }
}

package com.yanduoduo.support;

import com.yanduoduo.auth.exception.BusinessException;
import com.yanduoduo.auth.exception.ErrorCode;
import com.yanduoduo.user.domain.User;
import com.yanduoduo.user.service.UserService;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存版用户服务，保存副本以模拟数据库行为。
 */
public class InMemoryUserService implements UserService {

    private final Map<Long, User> users = new LinkedHashMap<>();
    private final AtomicLong ids = new AtomicLong(1000);

    @Override
    public Optional<User> findByPhone(String phone) {
        return users.values().stream().filter(u -> u.getPhone().equals(phone)).findFirst().map(InMemoryUserService::copy);
    }

    @Override
    public Optional<User> findById(long id) {
        return Optional.ofNullable(users.get(id)).map(InMemoryUserService::copy);
    }

    @Override
    public Optional<User> findByToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        return users.values().stream().filter(u -> Objects.equals(u.getToken(), token)).findFirst().map(InMemoryUserService::copy);
    }

    @Override
    public boolean existsByPhone(String phone) {
        return findByPhone(phone).isPresent();
    }

    @Override
    public User createUser(User user) {
        if (existsByPhone(user.getPhone())) {
            throw new BusinessException(ErrorCode.REGISTERED);
        }
        user.setId(ids.incrementAndGet());
        user.setCreatedAt(Instant.now());
        user.setUpdatedAt(user.getCreatedAt());
        users.put(user.getId(), copy(user));
        return user;
    }

    @Override
    public void updatePassword(User user) {
        User stored = users.get(user.getId());
        stored.setPasswordHash(user.getPasswordHash());
        stored.setPasswordSalt(user.getPasswordSalt());
    }

    @Override
    public void updateAvatar(long userId, String avatar) {
        users.get(userId).setAvatar(avatar);
    }

    @Override
    public void updateToken(long userId, String token, Instant expiresAt) {
        User stored = users.get(userId);
        stored.setToken(token);
        stored.setTokenExpiresAt(expiresAt);
    }

    public Collection<User> all() {
        return users.values();
    }

    public User put(User user) {
        if (user.getId() == null) {
            user.setId(ids.incrementAndGet());
        }
        users.put(user.getId(), copy(user));
        return user;
    }

    private static User copy(User user) {
        return User.builder()
                .id(user.getId())
                .phone(user.getPhone())
                .passwordHash(user.getPasswordHash())
                .passwordSalt(user.getPasswordSalt())
                .nickname(user.getNickname())
                .avatar(user.getAvatar())
                .token(user.getToken())
                .tokenExpiresAt(user.getTokenExpiresAt())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }
}

package com.yanduoduo.user.mapper;

import com.yanduoduo.user.domain.User;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;

@Mapper
public interface UserMapper {

    User findByPhone(@Param("phone") String phone);

    User findById(@Param("id") Long id);

    User findByToken(@Param("token") String token);

    boolean existsByPhone(@Param("phone") String phone);

    void insert(User user);

    void updatePassword(@Param("id") Long id,
                        @Param("passwordHash") String passwordHash,
                        @Param("passwordSalt") String passwordSalt,
                        @Param("updatedAt") Instant updatedAt);

    void updateAvatar(@Param("id") Long id, @Param("avatar") String avatar, @Param("updatedAt") Instant updatedAt);

    void updateToken(@Param("id") Long id,
                     @Param("token") String token,
                     @Param("tokenExpiresAt") Instant tokenExpiresAt,
                     @Param("updatedAt") Instant updatedAt);
}

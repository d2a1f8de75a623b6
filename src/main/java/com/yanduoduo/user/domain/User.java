package com.yanduoduo.user.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    private Long id;
    private String phone;
    private String passwordHash;
    private String passwordSalt;
    private String nickname;
    private String avatar;
    /** 当前会话令牌，登出后为空。 */
    private String token;
    private Instant tokenExpiresAt;
    private Instant createdAt;
    private Instant updatedAt;
}

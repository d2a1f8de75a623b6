package com.yanduoduo.auth.password;

/**
 * 加盐密码：随机盐与对应哈希，两者一同持久化。
 */
public record SaltedPassword(String salt, String hash) {
}

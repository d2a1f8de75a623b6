package com.yanduoduo.auth.password;

import com.yanduoduo.user.domain.User;
import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.codec.Hex;
import org.springframework.security.crypto.keygen.KeyGenerators;
import org.springframework.security.crypto.keygen.StringKeyGenerator;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

/**
 * 密码加盐哈希。
 * <p>
 * 每次设置密码都生成新的随机盐，先以盐为密钥对明文做 HMAC-SHA256，再交给 {@link PasswordEncoder}（BCrypt）。
 * BCrypt 只读取前 72 字节，摘要固定为 64 个十六进制字符，任意长度的密码整体参与比对。
 * 盐单独存放在用户记录的 `password_salt` 字段。
 */
@Component
@RequiredArgsConstructor
public class SaltedPasswordEncoder {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final StringKeyGenerator saltGenerator = KeyGenerators.string();
    private final PasswordEncoder passwordEncoder;

    /**
     * 为明文密码生成新盐与哈希。
     *
     * @param rawPassword 明文密码。
     * @return 盐与哈希。
     */
    public SaltedPassword encode(String rawPassword) {
        String salt = saltGenerator.generateKey();
        return new SaltedPassword(salt, passwordEncoder.encode(digest(salt, rawPassword)));
    }

    /**
     * 校验明文密码是否与用户当前密码一致。未设置密码的用户一律不匹配。
     *
     * @param user        用户实体。
     * @param rawPassword 明文密码。
     * @return 是否匹配。
     */
    public boolean matches(User user, String rawPassword) {
        if (rawPassword == null || !StringUtils.hasText(user.getPasswordHash())) {
            return false;
        }
        String salt = user.getPasswordSalt() != null ? user.getPasswordSalt() : "";
        return passwordEncoder.matches(digest(salt, rawPassword), user.getPasswordHash());
    }

    private static String digest(String salt, String rawPassword) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            // 空盐无法作为 HMAC 密钥
            byte[] key = ("pwd:" + salt).getBytes(StandardCharsets.UTF_8);
            mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
            return new String(Hex.encode(mac.doFinal(rawPassword.getBytes(StandardCharsets.UTF_8))));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HmacSHA256 unavailable", ex);
        }
    }
}

package com.yanduoduo.auth.password;

import com.yanduoduo.user.domain.User;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;

class SaltedPasswordEncoderTest {

    private final SaltedPasswordEncoder encoder = new SaltedPasswordEncoder(new BCryptPasswordEncoder(4));

    @Test
    void eachEncodingUsesFreshSalt() {
        SaltedPassword first = encoder.encode("p1");
        SaltedPassword second = encoder.encode("p1");

        assertThat(first.salt()).isNotBlank().isNotEqualTo(second.salt());
        assertThat(first.hash()).isNotEqualTo(second.hash());
    }

    @Test
    void matchesOnlyWithStoredSalt() {
        SaltedPassword salted = encoder.encode("secret1");
        User user = User.builder().passwordSalt(salted.salt()).passwordHash(salted.hash()).build();

        assertThat(encoder.matches(user, "secret1")).isTrue();
        assertThat(encoder.matches(user, "secret2")).isFalse();

        user.setPasswordSalt("other");
        assertThat(encoder.matches(user, "secret1")).isFalse();
    }

    @Test
    void userWithoutPasswordNeverMatches() {
        User user = User.builder().build();

        assertThat(encoder.matches(user, "")).isFalse();
        assertThat(encoder.matches(user, "anything")).isFalse();
        assertThat(encoder.matches(user, null)).isFalse();
    }

    @Test
    void everyCharacterOfLongPasswordsCounts() {
        String prefix = "a".repeat(100);
        SaltedPassword salted = encoder.encode(prefix + "RIGHT");
        User user = User.builder().passwordSalt(salted.salt()).passwordHash(salted.hash()).build();

        assertThat(encoder.matches(user, prefix + "RIGHT")).isTrue();
        assertThat(encoder.matches(user, prefix + "WRONG")).isFalse();
        assertThat(encoder.matches(user, prefix)).isFalse();
    }

    @Test
    void multiByteCharactersAreHashedWhole() {
        String prefix = "密".repeat(30);
        SaltedPassword salted = encoder.encode(prefix + "码1");
        User user = User.builder().passwordSalt(salted.salt()).passwordHash(salted.hash()).build();

        assertThat(encoder.matches(user, prefix + "码1")).isTrue();
        assertThat(encoder.matches(user, prefix + "码2")).isFalse();
    }
}

package com.yanduoduo.auth.token;

import com.yanduoduo.auth.config.AuthProperties;
import com.yanduoduo.auth.exception.BusinessException;
import com.yanduoduo.auth.exception.ErrorCode;
import com.yanduoduo.support.InMemoryUserService;
import com.yanduoduo.support.MutableClock;
import com.yanduoduo.support.TestJwt;
import com.yanduoduo.user.domain.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionTokenServiceTest {

    private MutableClock clock;
    private InMemoryUserService userService;
    private SessionTokenService sessionTokenService;
    private AuthProperties properties;
    private User user;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
        properties = TestJwt.properties();
        userService = new InMemoryUserService();
        sessionTokenService = new SessionTokenService(TestJwt.jwtService(properties, clock), userService, clock);
        user = userService.put(User.builder().phone("13800000000").nickname("n").build());
    }

    @Test
    void issueStoresSessionTokenOnUser() {
        TokenPair pair = sessionTokenService.issue(user);

        User stored = userService.findById(user.getId()).orElseThrow();
        assertThat(stored.getToken()).isEqualTo(pair.sessionToken());
        assertThat(stored.getTokenExpiresAt()).isEqualTo(Instant.parse("2024-05-08T00:00:00Z"));
    }

    @Test
    void refreshReplacesSessionToken() {
        TokenPair first = sessionTokenService.issue(user);
        clock.advance(Duration.ofDays(1));

        TokenPair refreshed = sessionTokenService.refresh(first.sessionToken());

        assertThat(refreshed.userId()).isEqualTo(user.getId());
        assertThat(refreshed.sessionToken()).isNotEqualTo(first.sessionToken());
        assertThat(userService.findByToken(first.sessionToken())).isEmpty();
        assertThat(userService.findByToken(refreshed.sessionToken())).isPresent();
    }

    @Test
    void refreshWithUnknownOrMissingTokenIsInvalid() {
        sessionTokenService.issue(user);
        String before = userService.findById(user.getId()).orElseThrow().getToken();

        assertThatThrownBy(() -> sessionTokenService.refresh("no-such-token"))
                .isInstanceOf(BusinessException.class)
                .extracting(ex -> ((BusinessException) ex).getErrorCode())
                .isEqualTo(ErrorCode.TOKEN_INVALID);
        assertThatThrownBy(() -> sessionTokenService.refresh(" "))
                .isInstanceOf(BusinessException.class)
                .extracting(ex -> ((BusinessException) ex).getErrorCode())
                .isEqualTo(ErrorCode.TOKEN_INVALID);
        assertThat(userService.findById(user.getId()).orElseThrow().getToken()).isEqualTo(before);
    }

    @Test
    void refreshWithExpiredTokenFailsWithoutIssuing() {
        TokenPair pair = sessionTokenService.issue(user);
        clock.advance(properties.getJwt().getSessionTokenTtl());

        assertThatThrownBy(() -> sessionTokenService.refresh(pair.sessionToken()))
                .isInstanceOf(BusinessException.class)
                .extracting(ex -> ((BusinessException) ex).getErrorCode())
                .isEqualTo(ErrorCode.TOKEN_EXPIRED);
        assertThat(userService.findById(user.getId()).orElseThrow().getToken()).isEqualTo(pair.sessionToken());
    }

    @Test
    void clearRemovesSession() {
        TokenPair pair = sessionTokenService.issue(user);

        sessionTokenService.clear(user.getId());

        User stored = userService.findById(user.getId()).orElseThrow();
        assertThat(stored.getToken()).isNull();
        assertThat(stored.getTokenExpiresAt()).isNull();
        assertThatThrownBy(() -> sessionTokenService.refresh(pair.sessionToken()))
                .isInstanceOf(BusinessException.class);
    }
}

package cn.bitsleep.taskrush.auth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TokenServiceTest {

    private static final String SECRET = "test-secret-test-secret-test-secret!";
    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
    private static final long TTL = 86_400L;

    @Mock
    private RedissonClient redisson;
    @Mock
    private RBucket<String> bucket;

    private TokenService tokens;

    @BeforeEach
    void setUp() {
        lenient().doReturn(bucket).when(redisson).getBucket(TokenService.TOKEN_KEY_PREFIX + "acc-1");
        tokens = at(NOW);
    }

    private TokenService at(Instant now) {
        return new TokenService(redisson, Clock.fixed(now, ZoneOffset.UTC), SECRET, TTL);
    }

    @Test
    void issuedTokenIsRegisteredWithTtl() {
        String token = tokens.issue("acc-1");

        assertNotNull(token);
        verify(bucket).set(token, TTL, TimeUnit.SECONDS);
    }

    @Test
    void liveTokenResolvesToAccount() {
        String token = tokens.issue("acc-1");
        when(bucket.get()).thenReturn(token);

        assertEquals("acc-1", tokens.validate(token));
    }

    @Test
    void replacedTokenIsRejected() {
        String token = tokens.issue("acc-1");
        when(bucket.get()).thenReturn("a-newer-token");

        assertNull(tokens.validate(token));
    }

    @Test
    void revokedTokenIsRejected() {
        String token = tokens.issue("acc-1");
        tokens.revoke("acc-1");
        when(bucket.get()).thenReturn(null);

        verify(bucket).delete();
        assertNull(tokens.validate(token));
    }

    @Test
    void expiredTokenIsRejected() {
        String token = tokens.issue("acc-1");

        assertNull(at(NOW.plus(Duration.ofSeconds(TTL + 60))).validate(token));
        verify(bucket, never()).get();
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        String token = new TokenService(redisson, Clock.fixed(NOW, ZoneOffset.UTC),
                "another-secret-another-secret-another", TTL).issue("acc-1");

        assertNull(tokens.validate(token));
    }

    @Test
    void garbageIsRejected() {
        assertNull(tokens.validate("not-a-jwt"));
        assertNull(tokens.validate(""));
    }

    @Test
    void shortSecretFailsFast() {
        assertThrows(IllegalStateException.class, () -> new TokenService(redisson, Clock.systemUTC(), "short", TTL));
        assertThrows(IllegalStateException.class, () -> new TokenService(redisson, Clock.systemUTC(), "", TTL));
    }
}

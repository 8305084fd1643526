package cn.bitsleep.taskrush.auth;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.concurrent.TimeUnit;

/**
 * Issues and checks HS256 bearer tokens. The live token of each account sits in Redis
 * with the same TTL as the token, so a new login replaces the old token and logout
 * revokes it before it expires.
 */
@Slf4j
@Service
public class TokenService {

    static final String TOKEN_KEY_PREFIX = "taskrush:auth:token:";
    private static final int MIN_SECRET_BYTES = 32;

    private final RedissonClient redissonClient;
    private final Clock clock;
    private final SecretKey key;
    private final long ttlSeconds;

    public TokenService(RedissonClient redissonClient,
                        Clock clock,
                        @Value("${taskrush.auth.jwt-secret:}") String secret,
                        @Value("${taskrush.auth.token-ttl-seconds:86400}") long ttlSeconds) {
        byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("taskrush.auth.jwt-secret must be set to at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.redissonClient = redissonClient;
        this.clock = clock;
        this.key = Keys.hmacShaKeyFor(secretBytes);
        this.ttlSeconds = ttlSeconds;
    }

    public String issue(String userId) {
        Instant now = clock.instant();
        String jws = Jwts.builder()
                .setSubject(userId)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusSeconds(ttlSeconds)))
                .signWith(key)
                .compact();
        bucket(userId).set(jws, ttlSeconds, TimeUnit.SECONDS);
        return jws;
    }

    /**
     * @return the account id the token was issued to, or {@code null} if the token is
     * malformed, expired, or no longer the account's live token
     */
    public String validate(String token) {
        String sub;
        try {
            sub = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token).getBody().getSubject();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            return null;
        }
        if (sub == null) return null;
        String stored = bucket(sub).get();
        return token.equals(stored) ? sub : null;
    }

    public void revoke(String userId) {
        bucket(userId).delete();
    }

    private RBucket<String> bucket(String userId) {
        return redissonClient.getBucket(TOKEN_KEY_PREFIX + userId);
    }
}

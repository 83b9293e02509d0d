package com.prediction.worthhub.worth_hub.security;

import static com.prediction.worthhub.worth_hub.support.Identities.identity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.prediction.worthhub.worth_hub.entity.Identity;
import com.prediction.worthhub.worth_hub.support.MutableClock;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

@DisplayName("JWT util")
class JwtUtilTest {

    private static final String SECRET = "worth-hub-test-secret-key-32-bytes!!";

    private final MutableClock clock = new MutableClock(1_700_000_000L);
    private final JwtUtil jwtUtil = new JwtUtil(SECRET, Duration.ofMinutes(10), clock);
    private final Identity signer = identity(0xA1);

    @Test
    @DisplayName("Should carry the signer identity as subject")
    void roundTrip() {
        String token = jwtUtil.issueToken(signer);

        assertThat(jwtUtil.validateToken(token)).isEqualTo(signer.toHex());
    }

    @Test
    @DisplayName("Should reject expired tokens")
    void expired() {
        String token = jwtUtil.issueToken(signer);
        clock.advanceSeconds(Duration.ofMinutes(11).toSeconds());

        assertThat(jwtUtil.validateToken(token)).isNull();
    }

    @Test
    @DisplayName("Should reject tokens signed with another key")
    void foreignKey() {
        JwtUtil other = new JwtUtil("another-secret-key-that-is-32-bytes-long", Duration.ofMinutes(10), clock);

        assertThat(jwtUtil.validateToken(other.issueToken(signer))).isNull();
        assertThat(jwtUtil.validateToken("not-a-token")).isNull();
    }

    @Test
    @DisplayName("Should reject a validly signed token whose subject is not an identity")
    void subjectNotIdentity() {
        String token = Jwts.builder()
                .subject("alice")
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();

        assertThat(jwtUtil.validateToken(token)).isNull();
    }

    @Test
    @DisplayName("Should refuse a secret shorter than 32 bytes")
    void shortSecret() {
        assertThatThrownBy(() -> new JwtUtil("short", Duration.ofMinutes(1), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

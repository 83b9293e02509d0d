package com.prediction.worthhub.worth_hub.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import javax.crypto.SecretKey;

import com.prediction.worthhub.worth_hub.entity.Identity;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues and validates the HMAC-signed tokens that carry a signer identity.
 * The subject is the 32-byte identity in hex.
 */
@Slf4j
public class JwtUtil {

    private final SecretKey key;
    private final Duration tokenTtl;
    private final Clock clock;

    public JwtUtil(String secret, Duration tokenTtl, Clock clock) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < 32) {
            throw new IllegalArgumentException("worthhub.security.jwt-secret must be at least 32 bytes");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenTtl = tokenTtl;
        this.clock = clock;
    }

    public String issueToken(Identity signer) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(signer.toHex())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(tokenTtl)))
                .signWith(key)
                .compact();
    }

    /**
     * @return the signer identity in hex, or null if the token is invalid,
     *         expired, or does not carry a well-formed identity
     */
    public String validateToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            return Identity.fromHex(claims.getSubject()).toHex();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            return null;
        }
    }
}

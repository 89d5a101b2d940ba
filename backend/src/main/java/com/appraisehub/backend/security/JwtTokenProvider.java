package com.appraisehub.backend.security;

import com.appraisehub.backend.entity.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Date;
import java.util.Optional;

/**
 * Validates HMAC-signed bearer tokens from the identity service.
 * The subject is the user id and the {@code role} claim the user's role.
 */
@Component
@Slf4j
public class JwtTokenProvider {

    static final String ROLE_CLAIM = "role";

    private final SecretKey key;
    private final Clock clock;

    public JwtTokenProvider(@Value("${jwt.secret}") String secret, Clock clock) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.clock = clock;
    }

    public Optional<AppraisalActor> parse(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            Long userId = Long.valueOf(claims.getSubject());
            User.UserRole role = User.UserRole.valueOf(claims.get(ROLE_CLAIM, String.class));
            return Optional.of(new AppraisalActor(userId, role));
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Rejected bearer token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Issues a token. Only the dev profile and tests need this; production
     * tokens come from the identity service.
     */
    public String generateToken(Long userId, User.UserRole role, Duration validity) {
        Date issuedAt = Date.from(clock.instant());
        return Jwts.builder()
                .subject(String.valueOf(userId))
                .claim(ROLE_CLAIM, role.name())
                .issuedAt(issuedAt)
                .expiration(Date.from(clock.instant().plus(validity)))
                .signWith(key)
                .compact();
    }
}

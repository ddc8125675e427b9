package com.openforge.lexguard.auth;

import com.openforge.lexguard.domain.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Optional;

@Slf4j
@Component
public class JwtUtil {

    private final SecretKey key;
    private final long      expirationMs;

    public JwtUtil(
            @Value("${app.jwt.secret}") String secret,
            @Value("${app.jwt.expiration-ms}") long expirationMs) {
        this.key          = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expirationMs = expirationMs;
    }

    /** Signed JWT: sub = userId, plus username and role claims. */
    public String generate(Long userId, String username, User.Role role) {
        long now = System.currentTimeMillis();
        return Jwts.builder()
                .subject(String.valueOf(userId))
                .claim("username", username)
                .claim("role", role.name())
                .issuedAt(new Date(now))
                .expiration(new Date(now + expirationMs))
                .signWith(key)
                .compact();
    }

    /** Extract all claims from a valid token. Throws JwtException if invalid. */
    public Claims parse(String token) {
        return Jwts.parser()
                .verifyWith(key)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    /** The authenticated identity carried by a token, or empty if the token is invalid. */
    public Optional<TokenPrincipal> authenticate(String token) {
        try {
            Claims claims = parse(token);
            String role = claims.get("role", String.class);
            return Optional.of(new TokenPrincipal(
                    Long.valueOf(claims.getSubject()),
                    claims.get("username", String.class),
                    role == null ? User.Role.USER : User.Role.valueOf(role)));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("[JWT] Invalid token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public record TokenPrincipal(Long userId, String username, User.Role role) {
    }
}

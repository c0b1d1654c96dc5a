package com.streamchat.auth.provider;

import com.streamchat.auth.model.StreamIdentity;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Optional;

/**
 * Verifies HS256 tokens issued by the platform's auth service with the shared secret.
 * Claims: userId, username, role, streamKey, allowedToStream.
 */
@Component
public class JwtIdentityProvider implements IdentityProvider {

    private static final Logger logger = LoggerFactory.getLogger(JwtIdentityProvider.class);

    private final Key signingKey;

    public JwtIdentityProvider(@Value("${streamchat.auth.jwt-secret}") String secret) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public Optional<StreamIdentity> verify(String bearerToken) {
        if (bearerToken == null || bearerToken.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .build()
                    .parseClaimsJws(bearerToken)
                    .getBody();

            String userId = claims.get("userId", String.class);
            if (userId == null || userId.isBlank()) {
                logger.warn("[token rejected] userId claim missing");
                return Optional.empty();
            }
            Boolean allowedToStream = claims.get("allowedToStream", Boolean.class);

            return Optional.of(StreamIdentity.builder()
                    .userId(userId)
                    .username(claims.get("username", String.class))
                    .role(Optional.ofNullable(claims.get("role", String.class)).orElse(StreamIdentity.ROLE_VIEWER))
                    .streamKey(claims.get("streamKey", String.class))
                    .allowedToStream(Boolean.TRUE.equals(allowedToStream))
                    .build());
        } catch (JwtException | IllegalArgumentException e) {
            logger.warn("[token rejected] {}", e.getMessage());
            return Optional.empty();
        }
    }
}

package com.ai.studyengine.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.util.Optional;

/**
 * JwtUtil validates bearer tokens issued by the account service.
 * Tokens are HMAC-signed with the shared {@code jwt.secret} (base64); this
 * service never issues tokens itself.
 */
@Slf4j
@Component
public class JwtUtil {

    private static final String TOKEN_TYPE_CLAIM = "tokenType";
    private static final String REFRESH_TOKEN = "refresh";

    private final SecretKey signingKey;

    public JwtUtil(@Value("${jwt.secret}") String secretKey) {
        this.signingKey = Keys.hmacShaKeyFor(Decoders.BASE64.decode(secretKey));
    }

    /**
     * Returns the subject (user id) of a valid, unexpired access token.
     * Refresh tokens and tokens that fail verification yield empty.
     */
    public Optional<String> validateAndGetSubject(String token) {
        try {
            Claims claims = extractAllClaims(token);
            if (REFRESH_TOKEN.equals(claims.get(TOKEN_TYPE_CLAIM, String.class))) {
                log.debug("Refresh token presented as bearer token");
                return Optional.empty();
            }
            return Optional.ofNullable(claims.getSubject()).filter(s -> !s.isBlank());
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("JWT validation failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // expiry is checked by the parser
    private Claims extractAllClaims(String token) {
        return Jwts.parser()
                .verifyWith(signingKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}

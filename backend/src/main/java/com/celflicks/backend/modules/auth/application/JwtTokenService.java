package com.celflicks.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.celflicks.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.celflicks.backend.modules.auth.presentation.dto.AccessTokenResponse;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    private static final String CLAIM_EMAIL = "email";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    public AccessTokenResponse issueAccessToken(UUID userId, String email) {
        Instant now = clock.instant();
        Instant expiry = now.plusMillis(accessTokenTtlMillis);

        String accessToken = Jwts.builder()
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(CLAIM_EMAIL, email)
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new AccessTokenResponse(
                accessToken,
                AccessTokenResponse.DEFAULT_TOKEN_TYPE,
                accessTokenTtlMillis / 1000L,
                OffsetDateTime.ofInstant(now, clock.getZone())
        );
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID userId = UUID.fromString(claims.getSubject());
            String email = claims.get(CLAIM_EMAIL, String.class);
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : clock.instant();
            return new ParsedToken(userId, email, OffsetDateTime.ofInstant(expiresAt, clock.getZone()));
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record ParsedToken(UUID userId, String email, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

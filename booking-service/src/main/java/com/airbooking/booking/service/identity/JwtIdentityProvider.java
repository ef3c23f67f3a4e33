package com.airbooking.booking.service.identity;

import com.airbooking.booking.dto.CallerIdentity;
import com.airbooking.booking.exception.UnauthorizedException;
import com.airbooking.booking.model.AppUser;
import com.airbooking.booking.repository.UserRepository;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * Verifies an HS256 bearer token whose subject is the user id. The role is read from the
 * user's current row, not from the token.
 */
@Component
@Slf4j
public class JwtIdentityProvider implements IdentityProvider {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final int MIN_SECRET_BYTES = 32;

    private final UserRepository userRepository;
    private final SecretKey signingKey;

    public JwtIdentityProvider(UserRepository userRepository,
                               @Value("${booking.security.jwt-secret}") String secret) {
        byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                    "booking.security.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.userRepository = userRepository;
        this.signingKey = Keys.hmacShaKeyFor(keyBytes);
    }

    @Override
    public CallerIdentity authenticate(String authorizationHeader) {
        if (!StringUtils.hasText(authorizationHeader) || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new UnauthorizedException("Missing bearer token");
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();

        Long userId = parseSubject(token);
        AppUser user = userRepository.findById(userId)
                .orElseThrow(() -> new UnauthorizedException("Unknown user"));
        return new CallerIdentity(user.getId(), user.getRole());
    }

    private Long parseSubject(String token) {
        String subject;
        try {
            subject = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload()
                    .getSubject();
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Rejected bearer token: {}", e.getMessage());
            throw new UnauthorizedException("Invalid or expired token", e);
        }

        try {
            return Long.valueOf(subject);
        } catch (NumberFormatException e) {
            throw new UnauthorizedException("Token subject is not a user id", e);
        }
    }
}

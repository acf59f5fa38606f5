package com.linlay.assistantgw.security;

import com.linlay.assistantgw.config.AppAuthProperties;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.ParseException;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Verifies HS256 bearer tokens signed with the SHA-256 digest of {@code agent.auth.secret}.
 */
public class JwtTokenVerifier {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenVerifier.class);

    private final AppAuthProperties properties;
    private final AtomicBoolean missingSecretWarned = new AtomicBoolean(false);

    public JwtTokenVerifier(AppAuthProperties properties) {
        this.properties = properties;
    }

    public Optional<AuthenticatedUser> verify(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        if (!StringUtils.hasText(properties.getSecret())) {
            if (missingSecretWarned.compareAndSet(false, true)) {
                log.warn("agent.auth.secret is not configured, all bearer tokens are rejected");
            }
            return Optional.empty();
        }

        SignedJWT jwt;
        JWTClaimsSet claims;
        try {
            jwt = SignedJWT.parse(token.trim());
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException ex) {
            log.debug("bearer token parse failed token={}", maskToken(token));
            return Optional.empty();
        }

        if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
            return Optional.empty();
        }
        try {
            if (!jwt.verify(new MACVerifier(deriveSigningKey(properties.getSecret())))) {
                return Optional.empty();
            }
        } catch (JOSEException ex) {
            log.debug("bearer token verification failed token={}", maskToken(token));
            return Optional.empty();
        }

        Date expiresAt = claims.getExpirationTime();
        if (expiresAt != null && expiresAt.toInstant().isBefore(Instant.now())) {
            return Optional.empty();
        }
        if (StringUtils.hasText(properties.getIssuer()) && !properties.getIssuer().equals(claims.getIssuer())) {
            return Optional.empty();
        }
        String subject = claims.getSubject();
        if (!StringUtils.hasText(subject)) {
            return Optional.empty();
        }
        return Optional.of(new AuthenticatedUser(subject.trim()));
    }

    static byte[] deriveSigningKey(String secret) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private static String maskToken(String token) {
        String value = token.trim();
        if (value.length() <= 12) {
            return "***";
        }
        return value.substring(0, 6) + "..." + value.substring(value.length() - 4);
    }

    public record AuthenticatedUser(String userId) {
    }
}

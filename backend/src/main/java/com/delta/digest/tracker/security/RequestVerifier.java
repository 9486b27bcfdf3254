package com.delta.digest.tracker.security;

import com.delta.digest.config.TrackerProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Date;
import java.util.List;

@Component
public class RequestVerifier {
    public static final String LOCAL_DEV_HEADER = "X-Local-Dev";
    public static final String SIGNATURE_HEADER = "Upstash-Signature";
    static final String SIGNATURE_ISSUER = "Upstash";

    private static final Logger log = LoggerFactory.getLogger(RequestVerifier.class);

    private final TrackerProperties properties;
    private final Clock clock;
    private final List<SecretKey> signingKeys;

    public RequestVerifier(TrackerProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.signingKeys = loadSigningKeys(properties.getSecurity());
    }

    public RequestOrigin verifyTrigger(String authorization, String localDevHeader) {
        return verify(authorization, localDevHeader, null, null, null);
    }

    public RequestOrigin verify(
        String authorization,
        String localDevHeader,
        String signature,
        String rawBody,
        String requestPath
    ) {
        TrackerProperties.Security security = properties.getSecurity();
        if (security.isLocalBypassEnabled() && "true".equalsIgnoreCase(trim(localDevHeader))) {
            log.debug("Local development request, skipping verification");
            return RequestOrigin.LOCAL_BYPASS;
        }
        if (matchesTriggerSecret(authorization, security.getTriggerSecret())) {
            return RequestOrigin.TRIGGER_SECRET;
        }
        if (security.isLocalBypassEnabled() && noSecretsConfigured(security)) {
            log.debug("No secrets configured, allowing request");
            return RequestOrigin.UNSECURED_DEV;
        }
        if (signature != null && !signature.isBlank()) {
            if (signingKeys.isEmpty()) {
                log.warn("Signed delivery received but no signing keys are configured");
            } else if (verifySignature(signature.trim(), rawBody, requestPath)) {
                return RequestOrigin.SIGNED_DELIVERY;
            }
        }
        throw new UnauthorizedRequestException("Unauthorized");
    }

    private boolean matchesTriggerSecret(String authorization, String secret) {
        if (secret == null || secret.isBlank() || authorization == null) {
            return false;
        }
        byte[] expected = ("Bearer " + secret).getBytes(StandardCharsets.UTF_8);
        byte[] actual = authorization.trim().getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, actual);
    }

    private boolean noSecretsConfigured(TrackerProperties.Security security) {
        return isBlank(security.getTriggerSecret())
            && isBlank(security.getCurrentSigningKey())
            && isBlank(security.getNextSigningKey());
    }

    private boolean verifySignature(String token, String rawBody, String requestPath) {
        String expectedSubject = properties.getDispatch().getBaseUrl() + (requestPath == null ? "" : requestPath);
        String expectedBodyHash = bodyHash(rawBody == null ? "" : rawBody);
        for (int i = 0; i < signingKeys.size(); i++) {
            try {
                Claims claims = Jwts.parser()
                    .verifyWith(signingKeys.get(i))
                    .clock(() -> Date.from(clock.instant()))
                    .clockSkewSeconds(properties.getSecurity().getClockSkewSeconds())
                    .requireIssuer(SIGNATURE_ISSUER)
                    .requireSubject(expectedSubject)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
                String bodyClaim = claims.get("body", String.class);
                if (bodyClaim == null || !stripPadding(bodyClaim).equals(expectedBodyHash)) {
                    log.warn("Signature body hash mismatch for {}", requestPath);
                    return false;
                }
                return true;
            } catch (JwtException | IllegalArgumentException e) {
                log.debug("Signature rejected by signing key {}: {}", i == 0 ? "current" : "next", e.getMessage());
            }
        }
        log.warn("Signature verification failed for {}", requestPath);
        return false;
    }

    static String bodyHash(String rawBody) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(rawBody.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static List<SecretKey> loadSigningKeys(TrackerProperties.Security security) {
        List<SecretKey> keys = new ArrayList<>();
        addKey(keys, "current", security.getCurrentSigningKey());
        addKey(keys, "next", security.getNextSigningKey());
        return keys;
    }

    private static void addKey(List<SecretKey> keys, String label, String value) {
        if (isBlank(value)) {
            return;
        }
        try {
            keys.add(Keys.hmacShaKeyFor(value.trim().getBytes(StandardCharsets.UTF_8)));
        } catch (WeakKeyException e) {
            log.warn("Ignoring {} signing key: {}", label, e.getMessage());
        }
    }

    private static String stripPadding(String value) {
        String out = value.trim();
        while (out.endsWith("=")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

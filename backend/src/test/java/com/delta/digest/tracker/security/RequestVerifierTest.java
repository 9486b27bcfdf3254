package com.delta.digest.tracker.security;

import com.delta.digest.config.TrackerProperties;
import com.delta.digest.tracker.support.MutableClock;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestVerifierTest {
    private static final String CURRENT_KEY = "current-signing-key-0123456789abcdef";
    private static final String NEXT_KEY = "next-signing-key-0123456789abcdefghij";
    private static final String PATH = "/api/job/discover";
    private static final String BODY = "{\"jobId\":\"1766221200000-abc123\",\"batchIndex\":0}";

    private final MutableClock clock = new MutableClock(Instant.parse("2025-12-20T09:00:00Z"));
    private TrackerProperties properties;

    @BeforeEach
    void setUp() {
        properties = new TrackerProperties();
        properties.getDispatch().setBaseUrl("https://tracker.example.com/");
        properties.getSecurity().setTriggerSecret("s3cret");
        properties.getSecurity().setCurrentSigningKey(CURRENT_KEY);
        properties.getSecurity().setNextSigningKey(NEXT_KEY);
    }

    @Test
    void acceptsTriggerSecretAsBearerToken() {
        assertThat(verifier().verifyTrigger("Bearer s3cret", null)).isEqualTo(RequestOrigin.TRIGGER_SECRET);
    }

    @Test
    void rejectsWrongOrMissingTriggerSecret() {
        RequestVerifier verifier = verifier();
        assertThatThrownBy(() -> verifier.verifyTrigger("Bearer nope", null))
            .isInstanceOf(UnauthorizedRequestException.class);
        assertThatThrownBy(() -> verifier.verifyTrigger(null, null))
            .isInstanceOf(UnauthorizedRequestException.class);
        assertThatThrownBy(() -> verifier.verifyTrigger("s3cret", null))
            .isInstanceOf(UnauthorizedRequestException.class);
    }

    @Test
    void localDevHeaderOnlyCountsWhenBypassEnabled() {
        assertThatThrownBy(() -> verifier().verifyTrigger(null, "true"))
            .isInstanceOf(UnauthorizedRequestException.class);

        properties.getSecurity().setLocalBypassEnabled(true);
        assertThat(verifier().verifyTrigger(null, "true")).isEqualTo(RequestOrigin.LOCAL_BYPASS);
    }

    @Test
    void bypassWithoutAnySecretsAllowsEverything() {
        properties.getSecurity().setLocalBypassEnabled(true);
        properties.getSecurity().setTriggerSecret(null);
        properties.getSecurity().setCurrentSigningKey(" ");
        properties.getSecurity().setNextSigningKey(null);

        assertThat(verifier().verify(null, null, null, BODY, PATH)).isEqualTo(RequestOrigin.UNSECURED_DEV);
    }

    @Test
    void acceptsDeliverySignedWithCurrentKey() {
        String token = sign(CURRENT_KEY, "https://tracker.example.com" + PATH, RequestVerifier.bodyHash(BODY));

        assertThat(verifier().verify(null, null, token, BODY, PATH)).isEqualTo(RequestOrigin.SIGNED_DELIVERY);
    }

    @Test
    void acceptsDeliverySignedWithNextKeyAndPaddedBodyHash() {
        String token = sign(NEXT_KEY, "https://tracker.example.com" + PATH, RequestVerifier.bodyHash(BODY) + "=");

        assertThat(verifier().verify(null, null, token, BODY, PATH)).isEqualTo(RequestOrigin.SIGNED_DELIVERY);
    }

    @Test
    void rejectsTamperedBody() {
        String token = sign(CURRENT_KEY, "https://tracker.example.com" + PATH, RequestVerifier.bodyHash(BODY));

        assertThatThrownBy(() -> verifier().verify(null, null, token, BODY.replace("0}", "1}"), PATH))
            .isInstanceOf(UnauthorizedRequestException.class);
    }

    @Test
    void rejectsTokenForAnotherEndpoint() {
        String token = sign(CURRENT_KEY, "https://tracker.example.com/api/job/fetch", RequestVerifier.bodyHash(BODY));

        assertThatThrownBy(() -> verifier().verify(null, null, token, BODY, PATH))
            .isInstanceOf(UnauthorizedRequestException.class);
    }

    @Test
    void rejectsUnknownKey() {
        String token = sign("some-other-signing-key-0123456789abcd", "https://tracker.example.com" + PATH,
            RequestVerifier.bodyHash(BODY));

        assertThatThrownBy(() -> verifier().verify(null, null, token, BODY, PATH))
            .isInstanceOf(UnauthorizedRequestException.class);
    }

    @Test
    void rejectsExpiredTokenBeyondSkew() {
        String token = sign(CURRENT_KEY, "https://tracker.example.com" + PATH, RequestVerifier.bodyHash(BODY));
        RequestVerifier verifier = verifier();

        clock.advance(Duration.ofMinutes(5).plusSeconds(30));
        assertThat(verifier.verify(null, null, token, BODY, PATH)).isEqualTo(RequestOrigin.SIGNED_DELIVERY);

        clock.advance(Duration.ofMinutes(1));
        assertThatThrownBy(() -> verifier.verify(null, null, token, BODY, PATH))
            .isInstanceOf(UnauthorizedRequestException.class);
    }

    @Test
    void weakSigningKeyIsIgnored() {
        properties.getSecurity().setCurrentSigningKey("short");
        String token = sign(NEXT_KEY, "https://tracker.example.com" + PATH, RequestVerifier.bodyHash(BODY));

        assertThat(verifier().verify(null, null, token, BODY, PATH)).isEqualTo(RequestOrigin.SIGNED_DELIVERY);
    }

    @Test
    void bodyHashIsUrlSafeWithoutPadding() {
        assertThat(RequestVerifier.bodyHash(""))
            .isEqualTo("47DEQpj8HBSa-_TImW-5JCeuQeRkm5NMpJWZG3hSuFU");
    }

    private RequestVerifier verifier() {
        return new RequestVerifier(properties, clock);
    }

    private String sign(String key, String subject, String bodyHash) {
        Instant issued = clock.instant();
        return Jwts.builder()
            .issuer(RequestVerifier.SIGNATURE_ISSUER)
            .subject(subject)
            .claim("body", bodyHash)
            .issuedAt(Date.from(issued))
            .notBefore(Date.from(issued))
            .expiration(Date.from(issued.plus(Duration.ofMinutes(5))))
            .signWith(Keys.hmacShaKeyFor(key.getBytes(StandardCharsets.UTF_8)))
            .compact();
    }
}

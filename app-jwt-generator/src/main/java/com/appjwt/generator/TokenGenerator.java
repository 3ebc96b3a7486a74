package com.appjwt.generator;

import com.appjwt.generator.exception.InvalidJtiException;
import com.appjwt.generator.exception.NotConfiguredException;
import com.appjwt.generator.exception.TokenSigningException;
import com.appjwt.generator.key.PemKeyLoader;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.security.PrivateKey;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Builds RS256-signed JWTs for an application.
 * <p>
 * Setters mutate this instance and return it for chaining. The token id is generated once
 * and reused by every {@link #generate()} call; {@code iat} and {@code exp} are read from the
 * clock on each call. Instances are not thread-safe.
 */
@Slf4j
public class TokenGenerator {

    public static final long DEFAULT_TTL_SECONDS = 900;

    private static final Pattern UUID_V4 = Pattern.compile(
        "^[0-9a-f]{8}-[0-9a-f]{4}-4[0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}$",
        Pattern.CASE_INSENSITIVE);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Getter
    private final String applicationId;
    private final String privateKeyPem;
    private final Clock clock;

    private PrivateKey signingKey;
    private long ttl = DEFAULT_TTL_SECONDS;
    private String jti;
    private Instant notBefore;
    private String subject;
    private Map<String, Map<String, Object>> paths = new LinkedHashMap<>();
    private final Map<String, Object> claims = new LinkedHashMap<>();

    public TokenGenerator(String applicationId, String privateKeyPem) {
        this(applicationId, privateKeyPem, Clock.systemUTC());
    }

    public TokenGenerator(String applicationId, String privateKeyPem, Clock clock) {
        this.applicationId = Objects.requireNonNull(applicationId, "applicationId");
        this.privateKeyPem = Objects.requireNonNull(privateKeyPem, "privateKeyPem");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public TokenGenerator(String applicationId, PrivateKey privateKey) {
        this(applicationId, privateKey, Clock.systemUTC());
    }

    public TokenGenerator(String applicationId, PrivateKey privateKey, Clock clock) {
        this.applicationId = Objects.requireNonNull(applicationId, "applicationId");
        this.signingKey = Objects.requireNonNull(privateKey, "privateKey");
        this.privateKeyPem = null;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * One-shot variant of the builder. Recognized option keys are {@code ttl}, {@code jti},
     * {@code paths}, {@code not_before} and {@code sub} (or {@code subject}); every other key
     * becomes a custom claim.
     *
     * @see TokenGeneratorOptions#fromMap(Map)
     */
    public static String factory(String applicationId, String privateKeyPem, Map<String, ?> options) {
        return factory(applicationId, privateKeyPem, options, Clock.systemUTC());
    }

    public static String factory(String applicationId, String privateKeyPem) {
        return factory(applicationId, privateKeyPem, Map.of());
    }

    public static String factory(String applicationId, String privateKeyPem, Map<String, ?> options, Clock clock) {
        TokenGeneratorOptions parsed = TokenGeneratorOptions.fromMap(options);
        TokenGenerator generator = new TokenGenerator(applicationId, privateKeyPem, clock);
        return parsed.applyTo(generator).generate();
    }

    /**
     * Assembles the claims and signs them.
     *
     * @throws TokenSigningException if the payload cannot be encoded or signed with the configured key
     * @throws IllegalStateException if {@code iat + ttl} does not fit in epoch seconds
     */
    public String generate() {
        long iat = clock.instant().getEpochSecond();
        long exp;
        try {
            exp = Math.addExact(iat, ttl);
        } catch (ArithmeticException e) {
            throw new IllegalStateException("TTL of " + ttl + " seconds overflows the expiration time", e);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(ClaimNames.ISSUED_AT, iat);
        payload.put(ClaimNames.EXPIRATION, exp);
        payload.put(ClaimNames.ID, getJTI());
        payload.put(ClaimNames.APPLICATION_ID, applicationId);
        if (!paths.isEmpty()) {
            payload.put(ClaimNames.ACL, Map.of(ClaimNames.ACL_PATHS, new LinkedHashMap<>(paths)));
        }
        if (notBefore != null) {
            payload.put(ClaimNames.NOT_BEFORE, notBefore.getEpochSecond());
        }
        if (subject != null) {
            payload.put(ClaimNames.SUBJECT, subject);
        }
        // custom claims are written verbatim, null values included
        payload.putAll(claims);

        String token;
        try {
            token = Jwts.builder()
                .header().type("JWT").and()
                .content(MAPPER.writeValueAsBytes(payload))
                .signWith(resolveSigningKey(), Jwts.SIG.RS256)
                .compact();
        } catch (JsonProcessingException e) {
            log.warn("Failed to encode claims for application {}: {}", applicationId, e.getMessage());
            throw new TokenSigningException("Unable to encode claims for application " + applicationId, e);
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Failed to sign token for application {}: {}", applicationId, e.getMessage());
            throw new TokenSigningException("Unable to sign token for application " + applicationId, e);
        }

        log.debug("Generated token for application {} jti={} exp={}", applicationId, jti, exp);
        return token;
    }

    private PrivateKey resolveSigningKey() {
        if (signingKey == null) {
            signingKey = PemKeyLoader.loadPrivateKey(privateKeyPem);
        }
        return signingKey;
    }

    public TokenGenerator setTTL(long seconds) {
        this.ttl = seconds;
        return this;
    }

    public long getTTL() {
        return ttl;
    }

    public TokenGenerator setJTI(String uuid) {
        if (uuid == null || !UUID_V4.matcher(uuid).matches()) {
            throw new InvalidJtiException("JTI must be a UUIDv4 string");
        }
        this.jti = uuid;
        return this;
    }

    public String getJTI() {
        if (jti == null) {
            jti = UUID.randomUUID().toString();
        }
        return jti;
    }

    public TokenGenerator setNotBefore(long epochSeconds) {
        return setNotBefore(Instant.ofEpochSecond(epochSeconds));
    }

    public TokenGenerator setNotBefore(Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp");
        this.notBefore = Instant.ofEpochSecond(timestamp.getEpochSecond());
        return this;
    }

    public Instant getNotBefore() {
        if (notBefore == null) {
            throw new NotConfiguredException("Not Before time has not been set");
        }
        return notBefore;
    }

    public TokenGenerator setSubject(String subject) {
        this.subject = Objects.requireNonNull(subject, "subject");
        return this;
    }

    public String getSubject() {
        if (subject == null) {
            throw new NotConfiguredException("Subject has not been set");
        }
        return subject;
    }

    public TokenGenerator addPath(String path) {
        return addPath(PathEntry.of(path));
    }

    public TokenGenerator addPath(String path, Map<String, ?> options) {
        return addPath(PathEntry.of(path, options));
    }

    public TokenGenerator addPath(PathEntry entry) {
        paths.put(entry.path(), entry.options());
        return this;
    }

    /**
     * Replaces every ACL path. Elements may be path strings, {@link PathEntry} values or
     * maps of path to options, mixed freely. A path given as a plain string is granted
     * with no options.
     */
    public TokenGenerator setPaths(List<?> pathData) {
        return replacePaths(PathEntry.decodeAll(pathData));
    }

    public TokenGenerator setPaths(Map<String, ? extends Map<String, ?>> pathData) {
        Objects.requireNonNull(pathData, "pathData");
        return replacePaths(PathEntry.decodeKeyed(pathData));
    }

    private TokenGenerator replacePaths(List<PathEntry> entries) {
        Map<String, Map<String, Object>> replacement = new LinkedHashMap<>();
        for (PathEntry entry : entries) {
            replacement.put(entry.path(), entry.options());
        }
        this.paths = replacement;
        return this;
    }

    public Map<String, Map<String, Object>> getPaths() {
        return Collections.unmodifiableMap(paths);
    }

    public TokenGenerator addClaim(String name, Object value) {
        claims.put(Objects.requireNonNull(name, "name"), value);
        return this;
    }

    public Map<String, Object> getClaims() {
        return Collections.unmodifiableMap(claims);
    }
}

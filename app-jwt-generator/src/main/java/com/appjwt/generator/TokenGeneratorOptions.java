package com.appjwt.generator;

import java.time.Instant;
import java.util.*;

import lombok.Getter;
import lombok.Setter;

/**
 * Typed form of the flat option map accepted by {@link TokenGenerator#factory(String, String, Map)}.
 * Unset values leave the generator's defaults in place.
 */
@Getter
@Setter
public class TokenGeneratorOptions {

    public static final String TTL = "ttl";
    public static final String JTI = "jti";
    public static final String PATHS = "paths";
    public static final String NOT_BEFORE = "not_before";
    public static final String SUB = "sub";
    public static final String SUBJECT = "subject";

    private long ttl = TokenGenerator.DEFAULT_TTL_SECONDS;
    private String jti;
    private List<PathEntry> paths;
    private Instant notBefore;
    private String subject;
    private Map<String, Object> claims = new LinkedHashMap<>();

    /**
     * Consumes the recognized keys and keeps every other key, in map order, as a custom claim.
     * When both {@code sub} and {@code subject} are present, {@code sub} wins.
     */
    public static TokenGeneratorOptions fromMap(Map<String, ?> options) {
        TokenGeneratorOptions parsed = new TokenGeneratorOptions();
        if (options == null) {
            return parsed;
        }
        Map<String, Object> remaining = new LinkedHashMap<>(options);

        if (remaining.containsKey(TTL)) {
            parsed.setTtl(toLong(TTL, remaining.remove(TTL)));
        }
        if (remaining.containsKey(JTI)) {
            parsed.setJti(toStringValue(JTI, remaining.remove(JTI)));
        }
        if (remaining.containsKey(PATHS)) {
            parsed.setPaths(toPaths(remaining.remove(PATHS)));
        }
        if (remaining.containsKey(NOT_BEFORE)) {
            parsed.setNotBefore(toInstant(remaining.remove(NOT_BEFORE)));
        }
        if (remaining.containsKey(SUBJECT)) {
            parsed.setSubject(toStringValue(SUBJECT, remaining.remove(SUBJECT)));
        }
        if (remaining.containsKey(SUB)) {
            parsed.setSubject(toStringValue(SUB, remaining.remove(SUB)));
        }

        parsed.getClaims().putAll(remaining);
        return parsed;
    }

    /**
     * Applies these options in the order the one-shot factory uses.
     */
    public TokenGenerator applyTo(TokenGenerator generator) {
        generator.setTTL(ttl);
        if (jti != null) {
            generator.setJTI(jti);
        }
        if (paths != null) {
            generator.setPaths(paths);
        }
        if (notBefore != null) {
            generator.setNotBefore(notBefore);
        }
        if (subject != null) {
            generator.setSubject(subject);
        }
        if (claims != null) {
            claims.forEach(generator::addClaim);
        }
        return generator;
    }

    private static long toLong(String key, Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        throw new IllegalArgumentException("Option '" + key + "' must be a number of seconds");
    }

    private static String toStringValue(String key, Object value) {
        if (value instanceof String s) {
            return s;
        }
        throw new IllegalArgumentException("Option '" + key + "' must be a string");
    }

    private static List<PathEntry> toPaths(Object value) {
        if (value instanceof Collection<?> list) {
            return PathEntry.decodeAll(list);
        }
        if (value instanceof Map<?, ?> keyed) {
            return PathEntry.decodeKeyed(keyed);
        }
        throw new IllegalArgumentException("Option 'paths' must be a list or a map");
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Number n) {
            return Instant.ofEpochSecond(n.longValue());
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        throw new IllegalArgumentException("Option 'not_before' must be epoch seconds, an Instant or a Date");
    }
}

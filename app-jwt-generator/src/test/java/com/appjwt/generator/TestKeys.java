package com.appjwt.generator;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/** Test key material under {@code src/test/resources/keys}. */
public final class TestKeys {
    private TestKeys() {}

    public static final String APPLICATION_ID = "d70425f2-1599-4e4c-81c4-cffc66e49a12";

    public static String privateKey() {
        return read("private.key");
    }

    public static String pkcs1PrivateKey() {
        return read("private-pkcs1.key");
    }

    public static String weakPrivateKey() {
        return read("weak.key");
    }

    public static String publicKeyPem() {
        return read("public.key");
    }

    public static PublicKey publicKey() {
        try {
            String body = publicKeyPem()
                .replace("-----BEGIN PUBLIC KEY-----", "")
                .replace("-----END PUBLIC KEY-----", "")
                .replaceAll("\\s+", "");
            return KeyFactory.getInstance("RSA")
                .generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(body)));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load test public key", e);
        }
    }

    static String read(String name) {
        try (InputStream in = TestKeys.class.getResourceAsStream("/keys/" + name)) {
            if (in == null) {
                throw new IllegalStateException("Missing test resource keys/" + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

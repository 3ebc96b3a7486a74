package com.appjwt.generator.key;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.util.encoders.DecoderException;

import java.io.IOException;
import java.io.StringReader;
import java.security.PrivateKey;
import java.util.Objects;

/**
 * Reads private keys from PEM text.
 * Accepts PKCS#8 ({@code BEGIN PRIVATE KEY}) and PKCS#1 ({@code BEGIN RSA PRIVATE KEY}) encodings.
 */
public final class PemKeyLoader {
    private PemKeyLoader() {}

    public static PrivateKey loadPrivateKey(String pem) {
        Objects.requireNonNull(pem, "pem");
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            Object object = parser.readObject();
            JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
            if (object instanceof PrivateKeyInfo info) {
                return converter.getPrivateKey(info);
            }
            if (object instanceof PEMKeyPair keyPair) {
                return converter.getKeyPair(keyPair).getPrivate();
            }
            throw new IllegalArgumentException("PEM does not contain an unencrypted private key");
        } catch (IOException | DecoderException e) {
            throw new IllegalArgumentException("Failed to parse private key from PEM", e);
        }
    }
}

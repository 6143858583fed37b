package com.bidmarket.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.bidmarket.backend.modules.auth.config.AuthProperties;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * HMAC key for access tokens. The configured secret may be Base64 or plain text and must carry at
 * least 256 bits.
 */
@Component
public class JwtSigningKeyProvider {

    public static final int MIN_SECRET_BYTES = 32;

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;

    @Autowired
    public JwtSigningKeyProvider(AuthProperties authProperties) {
        this(authProperties.jwt().secret());
    }

    public JwtSigningKeyProvider(String secretString) {
        if (secretString == null || secretString.isBlank()) {
            throw new IllegalStateException("bidmarket.auth.jwt.secret must be set");
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("bidmarket.auth.jwt.secret must be at least " + MIN_SECRET_BYTES
                    + " bytes (got " + keyBytes.length + ")");
        }
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}

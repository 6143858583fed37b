package com.bidmarket.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.regex.Pattern;

import com.bidmarket.backend.modules.auth.config.AuthProperties;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * BCrypt hashing for passwords and refresh-token verifiers.
 */
@Component
public class PasswordHasher {

    public static final int MIN_STRENGTH = 10;

    /**
     * BCrypt only reads this many bytes of input; anything longer is refused rather than truncated.
     */
    public static final int MAX_INPUT_BYTES = 72;

    private static final Pattern BCRYPT_FORMAT = Pattern.compile("^\\$2[aby]?\\$\\d\\d\\$[./0-9A-Za-z]{53}$");

    private final BCryptPasswordEncoder encoder;
    private final String dummyHash;

    @Autowired
    public PasswordHasher(AuthProperties authProperties, SecureRandom secureRandom) {
        this(authProperties.password().bcryptStrength(), secureRandom);
    }

    public PasswordHasher(int strength, SecureRandom secureRandom) {
        if (strength < MIN_STRENGTH || strength > 31) {
            throw new IllegalArgumentException("bcrypt strength must be between " + MIN_STRENGTH + " and 31");
        }
        this.encoder = new BCryptPasswordEncoder(strength, secureRandom);
        this.dummyHash = encoder.encode("dummy-password-for-timing");
    }

    public String hash(String rawPassword) {
        if (rawPassword == null) {
            throw new IllegalArgumentException("password must not be null");
        }
        if (!fitsBcryptInput(rawPassword)) {
            throw new IllegalArgumentException("password must be at most " + MAX_INPUT_BYTES + " bytes");
        }
        return encoder.encode(rawPassword);
    }

    /**
     * Constant-time check. Returns false for a null or over-long password or a missing or malformed hash.
     */
    public boolean verify(String rawPassword, String storedHash) {
        if (rawPassword == null || storedHash == null || !BCRYPT_FORMAT.matcher(storedHash).matches()) {
            return false;
        }
        if (!fitsBcryptInput(rawPassword)) {
            verifyAgainstDummy("");
            return false;
        }
        try {
            return encoder.matches(rawPassword, storedHash);
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    /**
     * Spends one full comparison and always returns false. Used when the account does not exist so
     * that the response time does not reveal it.
     */
    public boolean verifyAgainstDummy(String rawPassword) {
        encoder.matches(fitsBcryptInput(rawPassword) ? rawPassword : "", dummyHash);
        return false;
    }

    public static boolean fitsBcryptInput(String rawPassword) {
        return rawPassword != null && rawPassword.getBytes(StandardCharsets.UTF_8).length <= MAX_INPUT_BYTES;
    }

    public static boolean looksLikeHash(String value) {
        return value != null && BCRYPT_FORMAT.matcher(value).matches();
    }
}

package com.bidmarket.backend.modules.auth.application;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;

import com.bidmarket.backend.modules.auth.domain.TokenPair;

import org.springframework.stereotype.Component;

/**
 * Creates and parses refresh tokens of the form {@code selector.verifier}.
 */
@Component
public class TokenPairGenerator {

    public static final int SELECTOR_BYTES = 16;
    public static final int VERIFIER_BYTES = 32;
    public static final int SELECTOR_LENGTH = SELECTOR_BYTES * 2;
    public static final int VERIFIER_LENGTH = VERIFIER_BYTES * 2;

    private static final HexFormat HEX = HexFormat.of();

    private final SecureRandom secureRandom;

    public TokenPairGenerator(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    public TokenPair generate() {
        return new TokenPair(randomHex(SELECTOR_BYTES), randomHex(VERIFIER_BYTES));
    }

    /**
     * Splits and validates a presented token. Anything other than exactly one separator, a 32 char
     * hex selector and a 64 char hex verifier yields empty. Hex is accepted in either case and
     * returned lowercased.
     */
    public Optional<TokenPair> parse(String fullToken) {
        if (fullToken == null || fullToken.length() != SELECTOR_LENGTH + 1 + VERIFIER_LENGTH) {
            return Optional.empty();
        }
        int separator = fullToken.indexOf(TokenPair.SEPARATOR);
        if (separator != SELECTOR_LENGTH || fullToken.indexOf(TokenPair.SEPARATOR, separator + 1) >= 0) {
            return Optional.empty();
        }
        String selector = fullToken.substring(0, separator);
        String verifier = fullToken.substring(separator + 1);
        if (!isHex(selector) || !isHex(verifier)) {
            return Optional.empty();
        }
        return Optional.of(new TokenPair(selector.toLowerCase(Locale.ROOT), verifier.toLowerCase(Locale.ROOT)));
    }

    public static boolean isValidSelector(String selector) {
        return selector != null && selector.length() == SELECTOR_LENGTH && isHex(selector);
    }

    private String randomHex(int byteCount) {
        byte[] bytes = new byte[byteCount];
        secureRandom.nextBytes(bytes);
        return HEX.formatHex(bytes);
    }

    private static boolean isHex(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean hex = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
            if (!hex) {
                return false;
            }
        }
        return true;
    }
}

package com.bidmarket.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.SecureRandom;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PasswordHasherTest {

    private static PasswordHasher hasher;

    @BeforeAll
    static void setUp() {
        hasher = new PasswordHasher(10, new SecureRandom());
    }

    @Test
    void hashProducesBcryptStringThatVerifies() {
        String hash = hasher.hash("SecurePass123!");

        assertThat(hash).startsWith("$2").hasSize(60);
        assertThat(PasswordHasher.looksLikeHash(hash)).isTrue();
        assertThat(hasher.verify("SecurePass123!", hash)).isTrue();
        assertThat(hasher.verify("SecurePass124!", hash)).isFalse();
    }

    @Test
    void sameInputHashesDifferentlyEachTime() {
        String first = hasher.hash("SecurePass123!");
        String second = hasher.hash("SecurePass123!");

        assertThat(first).isNotEqualTo(second);
        assertThat(hasher.verify("SecurePass123!", first)).isTrue();
        assertThat(hasher.verify("SecurePass123!", second)).isTrue();
    }

    @Test
    void verifyFailsClosedOnBadInput() {
        String hash = hasher.hash("SecurePass123!");

        assertThat(hasher.verify(null, hash)).isFalse();
        assertThat(hasher.verify("SecurePass123!", null)).isFalse();
        assertThat(hasher.verify("SecurePass123!", "")).isFalse();
        assertThat(hasher.verify("SecurePass123!", "plaintext")).isFalse();
        assertThat(hasher.verify("SecurePass123!", hash.substring(0, 40))).isFalse();
    }

    @Test
    void dummyVerificationNeverSucceeds() {
        assertThat(hasher.verifyAgainstDummy("dummy-password-for-timing")).isFalse();
        assertThat(hasher.verifyAgainstDummy(null)).isFalse();
    }

    @Test
    @DisplayName("bytes beyond the BCrypt input limit never count as a match")
    void passwordsDifferingAfterSeventyTwoBytesDoNotMatch() {
        String prefix = "a".repeat(72);
        String storedHash = hasher.hash(prefix);

        assertThat(hasher.verify(prefix + "WrongTail", storedHash)).isFalse();
        assertThat(hasher.verify(prefix, storedHash)).isTrue();
        assertThatThrownBy(() -> hasher.hash(prefix + "CorrectTail"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void bcryptInputLimitCountsUtf8Bytes() {
        assertThat(PasswordHasher.fitsBcryptInput("a".repeat(72))).isTrue();
        assertThat(PasswordHasher.fitsBcryptInput("a".repeat(73))).isFalse();
        assertThat(PasswordHasher.fitsBcryptInput("\u00e9".repeat(36))).isTrue();
        assertThat(PasswordHasher.fitsBcryptInput("\u00e9".repeat(37))).isFalse();
        assertThat(PasswordHasher.fitsBcryptInput(null)).isFalse();
        assertThat(hasher.verifyAgainstDummy("a".repeat(100))).isFalse();
    }

    @Test
    void rejectsWeakWorkFactorAndNullPassword() {
        assertThatThrownBy(() -> new PasswordHasher(4, new SecureRandom()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> hasher.hash(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.bidmarket.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class BearerTokensTest {

    @Test
    void extractsTokenAfterScheme() {
        assertThat(BearerTokens.extract("Bearer abc.def.ghi")).contains("abc.def.ghi");
        assertThat(BearerTokens.extract("bearer abc.def.ghi ")).contains("abc.def.ghi");
    }

    @Test
    void ignoresOtherSchemesAndEmptyValues() {
        assertThat(BearerTokens.extract(null)).isEmpty();
        assertThat(BearerTokens.extract("Bearer ")).isEmpty();
        assertThat(BearerTokens.extract("Bearer    ")).isEmpty();
        assertThat(BearerTokens.extract("Basic dXNlcjpwYXNz")).isEmpty();
        assertThat(BearerTokens.extract("abc.def.ghi")).isEmpty();
    }
}

package com.reqsafe.token;

import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TokenAlgorithmTest {

    @Test
    void fromName_isCaseInsensitive() {
        assertThat(TokenAlgorithm.fromName(" es384 ")).isEqualTo(TokenAlgorithm.ES384);
        assertThatThrownBy(() -> TokenAlgorithm.fromName("none"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("none");
    }

    @Test
    void typedAccessors_matchFamily() {
        assertThat(TokenAlgorithm.HS512.macAlgorithm()).isSameAs(Jwts.SIG.HS512);
        assertThat(TokenAlgorithm.RS256.signatureAlgorithm()).isSameAs(Jwts.SIG.RS256);
        assertThat(TokenAlgorithm.ES256.headerName()).isEqualTo("ES256");

        assertThatThrownBy(TokenAlgorithm.HS256::signatureAlgorithm).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(TokenAlgorithm.ES512::macAlgorithm).isInstanceOf(IllegalStateException.class);
    }
}

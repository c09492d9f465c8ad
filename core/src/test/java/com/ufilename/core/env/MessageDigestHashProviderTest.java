package com.ufilename.core.env;

import com.ufilename.core.policy.NamingException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageDigestHashProviderTest {

    final MessageDigestHashProvider provider = new MessageDigestHashProvider();

    @Test
    void portableAndJcaNames_resolveToSameDigest() {
        byte[] data = "12345".getBytes(StandardCharsets.UTF_8);

        String portable = HexFormat.of().formatHex(provider.digest("sha256", data));
        String jca      = HexFormat.of().formatHex(provider.digest("SHA-256", data));

        assertThat(portable)
                .isEqualTo(jca)
                .isEqualTo("5994471abb01112afcc18159f6cc74b4f511b99806da59b3caf5a9c173cacfc5");
    }

    @Test
    void supports_commonNames() {
        assertThat(provider.supports("md5")).isTrue();
        assertThat(provider.supports("SHA1")).isTrue();
        assertThat(provider.supports("sha3_256")).isTrue();
        assertThat(provider.supports("sha512")).isTrue();
        assertThat(provider.supports("nope")).isFalse();
        assertThat(provider.supports("")).isFalse();
        assertThat(provider.supports(null)).isFalse();
    }

    @Test
    void digest_unknownName_throwsUnknownAlgorithm() {
        assertThatThrownBy(() -> provider.digest("nope", new byte[0]))
                .isInstanceOf(NamingException.class)
                .hasFieldOrPropertyWithValue("kind", NamingException.Kind.UNKNOWN_ALGORITHM);
    }
}

package com.ufilename.core.policy.impl;

import com.ufilename.core.env.HostIdentity;
import com.ufilename.core.env.RandomSource;
import com.ufilename.core.env.UuidSource;
import com.ufilename.core.policy.NamingContext;
import com.ufilename.core.policy.NamingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the stateless leaf policies.
 *
 * Collaborators (RNG, clock, UUIDs, host name) are fixed or mocked so the
 * expected names can be spelled out exactly.
 */
@ExtendWith(MockitoExtension.class)
class LeafPoliciesTest {

    static final NamingContext CTX = NamingContext.of("test", ".txt");

    @Mock UuidSource   uuids;
    @Mock HostIdentity host;

    // ------------------------------------------------------------------
    // identity / prefix / suffix
    // ------------------------------------------------------------------

    @Test
    void identity_returnsBaseUnchanged() {
        assertThat(new IdentityPolicy().generate(CTX)).isEqualTo("test");
    }

    @Test
    void prefix_prependsPrefix() {
        assertThat(new PrefixPolicy("pre_").generate(CTX)).isEqualTo("pre_test");
    }

    @Test
    void suffix_appendsSuffix() {
        assertThat(new SuffixPolicy("_suf").generate(CTX)).isEqualTo("test_suf");
    }

    @Test
    void prefixAndSuffix_emptyStrings_areNoOps() {
        assertThat(new PrefixPolicy("").generate(CTX)).isEqualTo("test");
        assertThat(new SuffixPolicy("").generate(CTX)).isEqualTo("test");
    }

    // ------------------------------------------------------------------
    // random_hex
    // ------------------------------------------------------------------

    @Test
    void randomHex_tokenHasExactLengthOfLowercaseHex() {
        for (int length : new int[] {1, 5, 6, 8, 31, 64}) {
            String name = new RandomHexPolicy(length, RandomSource.secure()).generate(CTX);
            assertThat(name).as("length %d", length).matches("test_[0-9a-f]{" + length + "}");
        }
    }

    @Test
    void randomHex_oddLength_dropsLastNibble() {
        RandomSource fixed = n -> new byte[] {(byte) 0xAB, (byte) 0xCD, (byte) 0xEF};

        assertThat(new RandomHexPolicy(5, fixed).generate(CTX)).isEqualTo("test_abcde");
    }

    @Test
    void randomHex_maxLength_requestsHalfAsManyBytes() {
        int[] requested = new int[1];
        RandomSource drained = n -> {
            requested[0] = n;
            throw new IllegalStateException("drained");
        };

        assertThatThrownBy(() -> new RandomHexPolicy(Integer.MAX_VALUE, drained).generate(CTX))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("drained");
        assertThat(requested[0]).isEqualTo(1 << 30);
    }

    @Test
    void builtins_reportTheirTag() {
        assertThat(new IdentityPolicy().type()).isEqualTo(IdentityPolicy.TYPE);
        assertThat(new PrefixPolicy("p").type()).isEqualTo(new PrefixPolicy("p").toConfig().type());
        assertThat(new RandomHexPolicy(4, RandomSource.secure()).type()).isEqualTo("random_hex");
        assertThat(new HostnamePolicy(true, host).type()).isEqualTo("hostname");
        assertThat(new UuidPolicy(4, uuids).type()).isEqualTo("uuid");
    }

    @Test
    void randomHex_twoCalls_differ() {
        RandomHexPolicy policy = new RandomHexPolicy(16, RandomSource.secure());
        assertThat(policy.generate(CTX)).isNotEqualTo(policy.generate(CTX));
    }

    @Test
    void randomHex_nonPositiveLength_invalidConfig() {
        assertThatThrownBy(() -> new RandomHexPolicy(0, RandomSource.secure()))
                .isInstanceOf(NamingException.class)
                .hasFieldOrPropertyWithValue("kind", NamingException.Kind.INVALID_CONFIG);
        assertThatThrownBy(() -> new RandomHexPolicy(-3, RandomSource.secure()))
                .hasFieldOrPropertyWithValue("kind", NamingException.Kind.INVALID_CONFIG);
    }

    // ------------------------------------------------------------------
    // timestamp
    // ------------------------------------------------------------------

    @Test
    void timestamp_defaultFormat_usesClockTime() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-05T07:08:09Z"), ZoneOffset.UTC);

        String name = new TimestampPolicy(TimestampPolicy.DEFAULT_FORMAT, clock).generate(CTX);

        assertThat(name).isEqualTo("test_20240305_070809");
    }

    @Test
    void timestamp_yearOnly() {
        Clock clock = Clock.fixed(Instant.parse("2031-12-31T23:59:59Z"), ZoneOffset.UTC);
        assertThat(new TimestampPolicy("%Y", clock).generate(CTX)).isEqualTo("test_2031");
    }

    @Test
    void timestamp_systemClock_matchesCurrentYear() {
        int year = java.time.Year.now().getValue();
        String name = new TimestampPolicy("%Y", Clock.systemDefaultZone()).generate(CTX);
        // Tolerate a New Year's Eve rollover between the two reads.
        assertThat(name).isIn("test_" + year, "test_" + (year + 1));
    }

    @Test
    void timestamp_unknownDirective_copiedLiterally() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        assertThat(new TimestampPolicy("%Q-%Y", clock).generate(CTX)).isEqualTo("test_%Q-2024");
    }

    // ------------------------------------------------------------------
    // uuid
    // ------------------------------------------------------------------

    @Test
    void uuid_version4_usesRandomUuid() {
        UUID id = UUID.fromString("0f8fad5b-d9cb-469f-a165-70867728950e");
        when(uuids.random()).thenReturn(id);

        assertThat(new UuidPolicy(4, uuids).generate(CTX)).isEqualTo("test_" + id);
        verify(uuids, never()).timeBased();
    }

    @Test
    void uuid_version1_usesTimeBasedUuid() {
        UUID id = UUID.fromString("c232ab00-9414-11ec-b3c8-9f6bdeced846");
        when(uuids.timeBased()).thenReturn(id);

        assertThat(new UuidPolicy(1, uuids).generate(CTX)).isEqualTo("test_" + id);
    }

    @Test
    void uuid_standardSource_producesRequestedVersions() {
        UuidSource standard = UuidSource.standard();
        String v4 = new UuidPolicy(4, standard).generate(CTX).substring("test_".length());
        String v1 = new UuidPolicy(1, standard).generate(CTX).substring("test_".length());

        assertThat(UUID.fromString(v4).version()).isEqualTo(4);
        assertThat(UUID.fromString(v1).version()).isEqualTo(1);
        assertThat(v4).matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
    }

    @Test
    void uuid_otherVersion_unsupported() {
        for (int version : new int[] {0, 2, 3, 5, 7}) {
            assertThatThrownBy(() -> new UuidPolicy(version, uuids))
                    .as("version %d", version)
                    .hasFieldOrPropertyWithValue("kind", NamingException.Kind.UNSUPPORTED_VERSION);
        }
    }

    // ------------------------------------------------------------------
    // hostname
    // ------------------------------------------------------------------

    @Test
    void hostname_short_truncatesAtFirstDot() {
        when(host.hostname()).thenReturn("build-7.ci.example.org");
        assertThat(new HostnamePolicy(true, host).generate(CTX)).isEqualTo("test_build-7");
    }

    @Test
    void hostname_full_keepsDomain() {
        when(host.hostname()).thenReturn("build-7.ci.example.org");
        assertThat(new HostnamePolicy(false, host).generate(CTX)).isEqualTo("test_build-7.ci.example.org");
    }

    @Test
    void hostname_short_withoutDot_unchanged() {
        when(host.hostname()).thenReturn("laptop");
        assertThat(new HostnamePolicy(true, host).generate(CTX)).isEqualTo("test_laptop");
    }

    @Test
    void hostname_localLookup_appendsSomething() {
        assertThat(new HostnamePolicy(true, HostIdentity.local()).generate(CTX))
                .startsWith("test_")
                .hasSizeGreaterThan("test_".length());
    }
}

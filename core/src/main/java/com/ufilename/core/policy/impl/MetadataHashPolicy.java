package com.ufilename.core.policy.impl;

import com.ufilename.core.env.HashProvider;
import com.ufilename.core.format.CanonicalValueWriter;
import com.ufilename.core.policy.*;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Appends {@code _<digest prefix>} computed from one metadata value, so the
 * same inputs always produce the same name.
 *
 * <p>The value is encoded with {@link CanonicalValueWriter} before hashing.
 * When the key is absent (or null) the base name passes through unchanged.
 * A {@code length} longer than the digest yields the whole digest.
 */
public class MetadataHashPolicy implements FilenamePolicy {

    public static final String TYPE = "metadata_hash";
    public static final String DEFAULT_KEY = "params";
    public static final String DEFAULT_ALGO = "sha256";
    public static final int DEFAULT_LENGTH = 16;

    private final String key;
    private final String algo;
    private final int length;
    private final HashProvider hashes;

    public MetadataHashPolicy(String key, String algo, int length, HashProvider hashes) {
        this.key    = Objects.requireNonNull(key, "key");
        this.algo   = Objects.requireNonNull(algo, "algo");
        this.hashes = Objects.requireNonNull(hashes, "hashes");
        if (length <= 0) {
            throw new NamingException(NamingException.Kind.INVALID_CONFIG,
                    "metadata_hash length must be positive, got " + length);
        }
        if (!hashes.supports(algo)) {
            throw new NamingException(NamingException.Kind.UNKNOWN_ALGORITHM,
                    "Unknown hash algorithm '" + algo + "'");
        }
        this.length = length;
    }

    public static MetadataHashPolicy fromConfig(PolicyConfig config, HashProvider hashes) {
        return new MetadataHashPolicy(
                config.getString("key", DEFAULT_KEY),
                config.getString("algo", DEFAULT_ALGO),
                config.getInt("length", DEFAULT_LENGTH),
                hashes);
    }

    public String key()  { return key; }
    public String algo() { return algo; }
    public int length()  { return length; }

    @Override
    public String generate(NamingContext ctx) {
        Object value = ctx.metadata().get(key);
        if (value == null) {
            return ctx.base();
        }
        byte[] raw = CanonicalValueWriter.write(value).getBytes(StandardCharsets.UTF_8);
        String hex = HexFormat.of().formatHex(hashes.digest(algo, raw));
        return ctx.base() + "_" + hex.substring(0, Math.min(length, hex.length()));
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public PolicyConfig toConfig() {
        return PolicyConfig.builder(TYPE)
                .put("key", key)
                .put("algo", algo)
                .put("length", length)
                .build();
    }
}

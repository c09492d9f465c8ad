package com.ufilename.core.policy.impl;

import com.ufilename.core.env.RandomSource;
import com.ufilename.core.policy.*;

import java.util.HexFormat;

/**
 * Appends {@code _<token>} where the token is {@code length} lowercase hex
 * characters drawn from a cryptographically secure source.
 */
public class RandomHexPolicy implements FilenamePolicy {

    public static final String TYPE = "random_hex";
    public static final int DEFAULT_LENGTH = 8;

    private final int length;
    private final RandomSource random;

    public RandomHexPolicy(int length, RandomSource random) {
        if (length <= 0) {
            throw new NamingException(NamingException.Kind.INVALID_CONFIG,
                    "random_hex length must be positive, got " + length);
        }
        this.length = length;
        this.random = random;
    }

    public static RandomHexPolicy fromConfig(PolicyConfig config, RandomSource random) {
        return new RandomHexPolicy(config.getInt("length", DEFAULT_LENGTH), random);
    }

    public int length() { return length; }

    @Override
    public String generate(NamingContext ctx) {
        // Two hex chars per byte; odd lengths drop the last nibble.
        byte[] bytes = random.randomBytes(length / 2 + length % 2);
        String token = HexFormat.of().formatHex(bytes).substring(0, length);
        return ctx.base() + "_" + token;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public PolicyConfig toConfig() {
        return PolicyConfig.builder(TYPE).put("length", length).build();
    }
}

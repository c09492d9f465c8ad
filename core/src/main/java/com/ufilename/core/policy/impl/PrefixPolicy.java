package com.ufilename.core.policy.impl;

import com.ufilename.core.policy.*;

import java.util.Objects;

/** Prepends a fixed string to the base name. */
public class PrefixPolicy implements FilenamePolicy {

    public static final String TYPE = "prefix";

    private final String prefix;

    public PrefixPolicy(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    public static PrefixPolicy fromConfig(PolicyConfig config) {
        return new PrefixPolicy(config.getString("prefix", ""));
    }

    public String prefix() { return prefix; }

    @Override
    public String generate(NamingContext ctx) {
        return prefix + ctx.base();
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public PolicyConfig toConfig() {
        return PolicyConfig.builder(TYPE).put("prefix", prefix).build();
    }
}

package com.ufilename.core.policy.impl;

import com.ufilename.core.policy.*;

import java.util.Objects;

/** Appends a fixed string to the base name (before the extension). */
public class SuffixPolicy implements FilenamePolicy {

    public static final String TYPE = "suffix";

    private final String suffix;

    public SuffixPolicy(String suffix) {
        this.suffix = Objects.requireNonNull(suffix, "suffix");
    }

    public static SuffixPolicy fromConfig(PolicyConfig config) {
        return new SuffixPolicy(config.getString("suffix", ""));
    }

    public String suffix() { return suffix; }

    @Override
    public String generate(NamingContext ctx) {
        return ctx.base() + suffix;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public PolicyConfig toConfig() {
        return PolicyConfig.builder(TYPE).put("suffix", suffix).build();
    }
}

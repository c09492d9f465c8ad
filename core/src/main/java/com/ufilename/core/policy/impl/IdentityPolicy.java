package com.ufilename.core.policy.impl;

import com.ufilename.core.policy.*;

/** Returns the base name as-is. */
public class IdentityPolicy implements FilenamePolicy {

    public static final String TYPE = "identity";

    public static IdentityPolicy fromConfig(PolicyConfig config) {
        return new IdentityPolicy();
    }

    @Override
    public String generate(NamingContext ctx) {
        return ctx.base();
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public PolicyConfig toConfig() {
        return PolicyConfig.builder(TYPE).build();
    }
}

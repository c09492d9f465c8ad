package com.ufilename.core.policy.impl;

import com.ufilename.core.env.UuidSource;
import com.ufilename.core.policy.*;

import java.util.UUID;

/** Appends {@code _<uuid>} in canonical form; version 4 (random) or 1 (time/node). */
public class UuidPolicy implements FilenamePolicy {

    public static final String TYPE = "uuid";
    public static final int DEFAULT_VERSION = 4;

    private final int version;
    private final UuidSource uuids;

    public UuidPolicy(int version, UuidSource uuids) {
        if (version != 1 && version != 4) {
            throw new NamingException(NamingException.Kind.UNSUPPORTED_VERSION,
                    "Only UUID versions 1 and 4 are supported, got " + version);
        }
        this.version = version;
        this.uuids   = uuids;
    }

    public static UuidPolicy fromConfig(PolicyConfig config, UuidSource uuids) {
        return new UuidPolicy(config.getInt("version", DEFAULT_VERSION), uuids);
    }

    public int version() { return version; }

    @Override
    public String generate(NamingContext ctx) {
        UUID uuid = version == 4 ? uuids.random() : uuids.timeBased();
        return ctx.base() + "_" + uuid;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public PolicyConfig toConfig() {
        return PolicyConfig.builder(TYPE).put("version", version).build();
    }
}

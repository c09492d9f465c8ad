package com.ufilename.core.policy.impl;

import com.ufilename.core.env.HostIdentity;
import com.ufilename.core.policy.*;

/**
 * Appends {@code _<hostname>}.  With {@code short} set, a fully qualified
 * name is cut at its first dot ("build-7.ci.example.org" becomes "build-7").
 */
public class HostnamePolicy implements FilenamePolicy {

    public static final String TYPE = "hostname";

    private final boolean shortName;
    private final HostIdentity host;

    public HostnamePolicy(boolean shortName, HostIdentity host) {
        this.shortName = shortName;
        this.host      = host;
    }

    public static HostnamePolicy fromConfig(PolicyConfig config, HostIdentity host) {
        return new HostnamePolicy(config.getBoolean("short", true), host);
    }

    public boolean shortName() { return shortName; }

    @Override
    public String generate(NamingContext ctx) {
        String name = host.hostname();
        int dot = name.indexOf('.');
        if (shortName && dot >= 0) {
            name = name.substring(0, dot);
        }
        return ctx.base() + "_" + name;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public PolicyConfig toConfig() {
        return PolicyConfig.builder(TYPE).put("short", shortName).build();
    }
}

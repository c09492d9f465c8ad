package com.ufilename.core.policy.impl;

import com.ufilename.core.format.StrftimeFormatter;
import com.ufilename.core.policy.*;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Appends {@code _<now>} rendered with a strftime-style pattern.
 *
 * The time is read from the clock on every call, in the clock's zone.
 * Unknown directives are copied into the name rather than rejected.
 */
public class TimestampPolicy implements FilenamePolicy {

    public static final String TYPE = "timestamp";
    public static final String DEFAULT_FORMAT = "%Y%m%d_%H%M%S";

    private final String fmt;
    private final Clock clock;

    public TimestampPolicy(String fmt, Clock clock) {
        this.fmt   = Objects.requireNonNull(fmt, "fmt");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static TimestampPolicy fromConfig(PolicyConfig config, Clock clock) {
        return new TimestampPolicy(config.getString("fmt", DEFAULT_FORMAT), clock);
    }

    public String fmt() { return fmt; }

    @Override
    public String generate(NamingContext ctx) {
        return ctx.base() + "_" + StrftimeFormatter.format(fmt, ZonedDateTime.now(clock));
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public PolicyConfig toConfig() {
        return PolicyConfig.builder(TYPE).put("fmt", fmt).build();
    }
}

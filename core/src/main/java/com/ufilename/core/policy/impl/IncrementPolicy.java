package com.ufilename.core.policy.impl;

import com.ufilename.core.env.PathProbe;
import com.ufilename.core.policy.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Appends the first free sequence number: {@code _001}, {@code _002}, ...
 *
 * <p>Candidates {@code start, start+1, ...} are zero-padded to {@code width}
 * and checked as {@code <directory>/<base>_<n><ext>}; the first one that does
 * not exist wins.  The check is look-then-act with no lock, so two callers
 * racing on the same directory may pick the same number.
 *
 * <p>The scan gives up after {@code maxAttempts} existing candidates.
 */
public class IncrementPolicy implements FilenamePolicy {

    private static final Logger log = LoggerFactory.getLogger(IncrementPolicy.class);

    public static final String TYPE = "increment";
    public static final int DEFAULT_WIDTH = 3;
    public static final int DEFAULT_START = 1;
    public static final int DEFAULT_MAX_ATTEMPTS = 10_000;

    private final int width;
    private final int start;
    private final int maxAttempts;
    private final PathProbe paths;

    public IncrementPolicy(int width, int start, int maxAttempts, PathProbe paths) {
        if (width < 0) {
            throw new NamingException(NamingException.Kind.INVALID_CONFIG,
                    "increment width must not be negative, got " + width);
        }
        if (maxAttempts <= 0) {
            throw new NamingException(NamingException.Kind.INVALID_CONFIG,
                    "increment max_attempts must be positive, got " + maxAttempts);
        }
        this.width       = width;
        this.start       = start;
        this.maxAttempts = maxAttempts;
        this.paths       = paths;
    }

    public IncrementPolicy(int width, int start, PathProbe paths) {
        this(width, start, DEFAULT_MAX_ATTEMPTS, paths);
    }

    public static IncrementPolicy fromConfig(PolicyConfig config, PathProbe paths) {
        return new IncrementPolicy(
                config.getInt("width", DEFAULT_WIDTH),
                config.getInt("start", DEFAULT_START),
                config.getInt("max_attempts", DEFAULT_MAX_ATTEMPTS),
                paths);
    }

    public int width()       { return width; }
    public int start()       { return start; }
    public int maxAttempts() { return maxAttempts; }

    @Override
    public String generate(NamingContext ctx) {
        Path directory = ctx.directory();
        if (directory == null) {
            throw new NamingException(NamingException.Kind.MISSING_DIRECTORY,
                    "increment policy requires a directory in the naming context");
        }

        long n = start;
        for (int attempt = 0; attempt < maxAttempts; attempt++, n++) {
            String candidate = ctx.base() + "_" + zeroPad(n);
            if (!paths.exists(directory.resolve(candidate + ctx.ext()))) {
                return candidate;
            }
            log.trace("Skipping taken name {}{} in {}", candidate, ctx.ext(), directory);
        }
        throw new NamingException(NamingException.Kind.EXHAUSTED_ATTEMPTS,
                "No free sequence number for '%s%s' in %s after %d attempts (from %d)"
                        .formatted(ctx.base(), ctx.ext(), directory, maxAttempts, start));
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public PolicyConfig toConfig() {
        return PolicyConfig.builder(TYPE)
                .put("width", width)
                .put("start", start)
                .put("max_attempts", maxAttempts)
                .build();
    }

    // Same as printf %0<width>d: the sign counts toward the width.
    private String zeroPad(long n) {
        return width == 0 ? Long.toString(n) : String.format("%0" + width + "d", n);
    }
}

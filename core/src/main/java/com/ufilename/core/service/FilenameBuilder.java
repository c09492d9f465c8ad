package com.ufilename.core.service;

import com.ufilename.core.policy.FilenamePolicy;
import com.ufilename.core.policy.NamingContext;
import com.ufilename.core.policy.NamingException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point: wraps the inputs in a {@link NamingContext}, runs the policy,
 * and appends the extension.
 *
 * <p>No policy lookup happens here.  Callers pass a policy they built
 * directly or resolved through a {@code PolicyRegistry}.
 *
 * <p>Every call is timed and counted:
 * <pre>
 *   ufilename.build.calls{policy, status="success|invalid_config|missing_directory|...|error"}
 *   ufilename.build.duration{policy}
 * </pre>
 */
public class FilenameBuilder {

    private static final Logger log = LoggerFactory.getLogger(FilenameBuilder.class);

    private final MeterRegistry meterRegistry;

    public FilenameBuilder(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    /** Builder whose metrics stay in a private in-memory registry. */
    public FilenameBuilder() {
        this(new SimpleMeterRegistry());
    }

    public String build(FilenamePolicy policy, String base, String ext) {
        return build(policy, base, ext, null, null);
    }

    public String build(FilenamePolicy policy, String base, String ext, Path directory) {
        return build(policy, base, ext, directory, null);
    }

    /**
     * @param directory destination directory; may be null unless the policy scans it
     * @param metadata  values for metadata-driven policies; null means empty
     * @throws NamingException whatever the policy chain raises, unchanged
     */
    public String build(FilenamePolicy policy, String base, String ext,
                        Path directory, Map<String, ?> metadata) {
        Objects.requireNonNull(policy, "policy");
        NamingContext ctx = new NamingContext(base, ext, directory,
                metadata == null ? null : new LinkedHashMap<String, Object>(metadata));
        String policyTag = policy.type();

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            String filename = policy.generate(ctx) + ext;
            log.debug("Built filename '{}' from base '{}' with policy '{}'", filename, base, policyTag);
            return filename;
        } catch (NamingException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("ufilename.build.duration", "policy", policyTag));
            meterRegistry.counter("ufilename.build.calls",
                    "policy", policyTag, "status", status).increment();
        }
    }
}

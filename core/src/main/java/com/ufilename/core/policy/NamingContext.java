package com.ufilename.core.policy;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Input threaded through a policy chain.
 *
 * Only {@code base} changes between chain steps; {@code ext}, {@code directory}
 * and {@code metadata} are carried unchanged.  {@code ext} is the extension
 * including its leading separator (".txt"), or "" for none.
 *
 * @param base      current base name, without extension
 * @param ext       extension appended by the builder; never rewritten by policies
 * @param directory destination directory, or null when the caller did not give one
 * @param metadata  caller-supplied values; a null value counts as absent
 */
public record NamingContext(String base, String ext, Path directory, Map<String, Object> metadata) {

    public NamingContext {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(ext, "ext");
        // LinkedHashMap instead of Map.copyOf: metadata may hold null values.
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static NamingContext of(String base, String ext) {
        return new NamingContext(base, ext, null, Map.of());
    }

    /** Same context with a different base name. */
    public NamingContext withBase(String newBase) {
        return new NamingContext(newBase, ext, directory, metadata);
    }
}

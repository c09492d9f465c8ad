package com.ufilename.core.policy;

/**
 * A naming strategy: turns the context's base name into a new base name.
 *
 * <p>Implementations own only their configuration fields and must round-trip
 * through {@link #toConfig()} and their type's {@code fromConfig} factory:
 * resolving {@code toConfig()} and serializing the result again yields an
 * equal config.
 *
 * <p>The extension is never part of the result; {@code FilenameBuilder}
 * appends it after the whole chain has run.
 */
public interface FilenamePolicy {

    /**
     * Produce the next base name (no extension).
     *
     * @throws NamingException when the context or a collaborator makes the name impossible
     */
    String generate(NamingContext ctx);

    /** Serializable configuration, including the {@code type} tag. */
    PolicyConfig toConfig();

    /** Registry tag of this policy.  Built-ins return their {@code TYPE} constant. */
    default String type() {
        return toConfig().type();
    }
}

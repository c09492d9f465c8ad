package com.ufilename.core.policy;

/**
 * Thrown when a policy cannot be configured, resolved, or applied.
 *
 * Unchecked: every failure is raised at the point of misuse and is never
 * retried internally, so callers only catch it when they have a specific
 * recovery in mind.  {@link #getKind()} tells them which one.
 */
public class NamingException extends RuntimeException {

    public enum Kind {
        /** Malformed or out-of-range policy parameter. */
        INVALID_CONFIG,
        /** Config handed to the registry has no {@code type}. */
        MISSING_TYPE,
        /** Config {@code type} is not registered. */
        UNKNOWN_TYPE,
        /** A type tag was registered twice. */
        DUPLICATE_REGISTRATION,
        /** A directory-scanning policy ran without a directory in the context. */
        MISSING_DIRECTORY,
        /** Hash algorithm name not supported by the hash provider. */
        UNKNOWN_ALGORITHM,
        /** UUID version other than 1 or 4. */
        UNSUPPORTED_VERSION,
        /** Sequence scan hit its attempt bound without finding a free name. */
        EXHAUSTED_ATTEMPTS,
        /** Metadata value has no canonical encoding. */
        INVALID_METADATA
    }

    private final Kind kind;

    public NamingException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public NamingException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}

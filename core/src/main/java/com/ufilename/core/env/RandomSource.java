package com.ufilename.core.env;

import java.security.SecureRandom;

/** Source of cryptographically strong random bytes. */
@FunctionalInterface
public interface RandomSource {

    byte[] randomBytes(int count);

    /** Backed by a single {@link SecureRandom}; safe for concurrent use. */
    static RandomSource secure() {
        SecureRandom random = new SecureRandom();
        return count -> {
            byte[] bytes = new byte[count];
            random.nextBytes(bytes);
            return bytes;
        };
    }
}

package com.ufilename.core.env;

import java.time.Clock;
import java.util.Objects;

/**
 * The external collaborators policies consume.  None of them is
 * reimplemented here; each field is a narrow contract with a JDK- or
 * library-backed default.
 *
 * Tests swap individual collaborators with the {@code with*} methods.
 */
public record NamingEnvironment(
        Clock        clock,
        RandomSource random,
        UuidSource   uuids,
        HostIdentity host,
        HashProvider hashes,
        PathProbe    paths) {

    public NamingEnvironment {
        Objects.requireNonNull(clock,  "clock");
        Objects.requireNonNull(random, "random");
        Objects.requireNonNull(uuids,  "uuids");
        Objects.requireNonNull(host,   "host");
        Objects.requireNonNull(hashes, "hashes");
        Objects.requireNonNull(paths,  "paths");
    }

    /** System clock in the default zone, SecureRandom, JDK/JUG UUIDs, resolver hostname, JCA digests, real filesystem. */
    public static NamingEnvironment defaults() {
        return new NamingEnvironment(
                Clock.systemDefaultZone(),
                RandomSource.secure(),
                UuidSource.standard(),
                HostIdentity.local(),
                new MessageDigestHashProvider(),
                PathProbe.filesystem());
    }

    public NamingEnvironment withClock(Clock clock) {
        return new NamingEnvironment(clock, random, uuids, host, hashes, paths);
    }

    public NamingEnvironment withRandom(RandomSource random) {
        return new NamingEnvironment(clock, random, uuids, host, hashes, paths);
    }

    public NamingEnvironment withUuids(UuidSource uuids) {
        return new NamingEnvironment(clock, random, uuids, host, hashes, paths);
    }

    public NamingEnvironment withHost(HostIdentity host) {
        return new NamingEnvironment(clock, random, uuids, host, hashes, paths);
    }

    public NamingEnvironment withHashes(HashProvider hashes) {
        return new NamingEnvironment(clock, random, uuids, host, hashes, paths);
    }

    public NamingEnvironment withPaths(PathProbe paths) {
        return new NamingEnvironment(clock, random, uuids, host, hashes, paths);
    }
}

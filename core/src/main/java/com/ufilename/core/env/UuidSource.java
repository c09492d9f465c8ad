package com.ufilename.core.env;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedGenerator;

import java.util.UUID;

/**
 * Produces fresh UUIDs.
 *
 * The JDK only generates version 4, so version 1 (time + node based) comes
 * from java-uuid-generator.
 */
public interface UuidSource {

    /** Version 4 (random). */
    UUID random();

    /** Version 1 (timestamp + node). */
    UUID timeBased();

    static UuidSource standard() {
        TimeBasedGenerator timeBased = Generators.timeBasedGenerator();
        return new UuidSource() {
            @Override public UUID random()    { return UUID.randomUUID(); }
            @Override public UUID timeBased() { return timeBased.generate(); }
        };
    }
}

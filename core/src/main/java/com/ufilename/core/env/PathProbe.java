package com.ufilename.core.env;

import java.nio.file.Files;
import java.nio.file.Path;

/** Read-only existence check against the filesystem. */
@FunctionalInterface
public interface PathProbe {

    boolean exists(Path path);

    static PathProbe filesystem() {
        return Files::exists;
    }
}

package com.ufilename.core.env;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;

/** Name of the machine the process runs on. */
@FunctionalInterface
public interface HostIdentity {

    String hostname();

    /** Always reports {@code name}; for containers whose resolver hostname is meaningless. */
    static HostIdentity fixed(String name) {
        return () -> name;
    }

    /**
     * Resolver-backed lookup.
     *
     * Falls back to the HOSTNAME / COMPUTERNAME environment variables and
     * finally "localhost" when the local address cannot be resolved.
     */
    static HostIdentity local() {
        return LocalHost.INSTANCE;
    }

    final class LocalHost implements HostIdentity {

        private static final Logger log = LoggerFactory.getLogger(LocalHost.class);

        static final LocalHost INSTANCE = new LocalHost();

        private LocalHost() {}

        @Override
        public String hostname() {
            try {
                return InetAddress.getLocalHost().getHostName();
            } catch (UnknownHostException e) {
                String fromEnv = firstNonBlank(System.getenv("HOSTNAME"), System.getenv("COMPUTERNAME"));
                String host = fromEnv != null ? fromEnv : "localhost";
                log.warn("Local host lookup failed ({}); using '{}'", e.getMessage(), host);
                return host;
            }
        }

        private static String firstNonBlank(String... candidates) {
            for (String c : candidates) {
                if (c != null && !c.isBlank()) return c;
            }
            return null;
        }
    }
}

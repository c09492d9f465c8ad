package com.ufilename.core.policy;

import com.ufilename.core.env.NamingEnvironment;
import com.ufilename.core.policy.impl.BuiltinPolicies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps policy type tags to their reverse constructors.
 *
 * <p>Build one at process start (usually {@link #newDefaultRegistry()}),
 * register any custom policies, then hand it to whatever needs to turn
 * configs into policies.  There is no global instance and no removal.
 *
 * <p>Registration is expected to finish before concurrent use begins;
 * {@link #resolve} is safe to call from many threads after that.
 */
public class PolicyRegistry {

    private static final Logger log = LoggerFactory.getLogger(PolicyRegistry.class);

    private final Map<String, PolicyFactory> factories = new ConcurrentHashMap<>();
    private final NamingEnvironment environment;

    public PolicyRegistry(NamingEnvironment environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    /** Registry with the built-in policies, backed by the default environment. */
    public static PolicyRegistry newDefaultRegistry() {
        return newDefaultRegistry(NamingEnvironment.defaults());
    }

    /** Registry with the built-in policies, backed by {@code environment}. */
    public static PolicyRegistry newDefaultRegistry(NamingEnvironment environment) {
        PolicyRegistry registry = new PolicyRegistry(environment);
        BuiltinPolicies.registerAll(registry);
        return registry;
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    /**
     * @throws NamingException DUPLICATE_REGISTRATION if {@code type} is taken
     */
    public void register(String type, PolicyFactory factory) {
        Objects.requireNonNull(factory, "factory");
        if (type == null || type.isBlank()) {
            throw new NamingException(NamingException.Kind.INVALID_CONFIG,
                    "Policy type tag must not be blank");
        }
        if (factories.putIfAbsent(type, factory) != null) {
            throw new NamingException(NamingException.Kind.DUPLICATE_REGISTRATION,
                    "Policy type '" + type + "' already registered");
        }
        log.info("Registered filename policy '{}'", type);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    /**
     * Build the policy described by {@code config}.  Policy-specific fields are
     * validated by the type's factory, not here.
     *
     * @throws NamingException MISSING_TYPE, UNKNOWN_TYPE, or whatever the factory raises
     */
    public FilenamePolicy resolve(PolicyConfig config) {
        Objects.requireNonNull(config, "config");
        String type = config.type();
        if (type == null || type.isBlank()) {
            throw new NamingException(NamingException.Kind.MISSING_TYPE,
                    "Missing '" + PolicyConfig.TYPE + "' in policy config " + config);
        }
        PolicyFactory factory = factories.get(type);
        if (factory == null) {
            throw new NamingException(NamingException.Kind.UNKNOWN_TYPE,
                    "Unknown policy type '" + type + "'");
        }
        return factory.create(config, this);
    }

    public FilenamePolicy resolve(Map<String, ?> config) {
        return resolve(PolicyConfig.of(config));
    }

    public boolean isRegistered(String type) {
        return type != null && factories.containsKey(type);
    }

    /** All registered tags (sorted). */
    public List<String> types() {
        return factories.keySet().stream().sorted().toList();
    }

    public NamingEnvironment environment() {
        return environment;
    }
}

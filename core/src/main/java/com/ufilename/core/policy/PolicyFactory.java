package com.ufilename.core.policy;

/**
 * Reverse constructor registered under a type tag.
 *
 * The registry is handed in so factories can reach the naming environment
 * and, for container policies, resolve nested configs.  Policies must not
 * keep a reference to it.
 */
@FunctionalInterface
public interface PolicyFactory {

    /**
     * @throws NamingException with kind INVALID_CONFIG (or a more specific kind)
     *                         when a policy-specific field is unusable
     */
    FilenamePolicy create(PolicyConfig config, PolicyRegistry registry);
}

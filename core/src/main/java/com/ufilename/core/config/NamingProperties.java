package com.ufilename.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code ufilename.*} settings.
 *
 * @param defaultPolicy JSON config of the policy exposed as the default
 *                      {@code FilenamePolicy} bean
 * @param hostname      fixed host name for the hostname policy; blank means
 *                      "ask the resolver"
 */
@ConfigurationProperties(prefix = "ufilename")
public record NamingProperties(String defaultPolicy, String hostname) {

    public static final String IDENTITY_POLICY = "{\"type\":\"identity\"}";

    // Compact constructor: fall back to the identity policy when unset.
    public NamingProperties {
        if (defaultPolicy == null || defaultPolicy.isBlank()) defaultPolicy = IDENTITY_POLICY;
    }
}

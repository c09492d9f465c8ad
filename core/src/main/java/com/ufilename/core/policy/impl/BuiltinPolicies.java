package com.ufilename.core.policy.impl;

import com.ufilename.core.policy.PolicyRegistry;

/** Registers the policies that ship with the library. */
public final class BuiltinPolicies {

    private BuiltinPolicies() {}

    public static void registerAll(PolicyRegistry registry) {
        registry.register(IdentityPolicy.TYPE,  (cfg, reg) -> IdentityPolicy.fromConfig(cfg));
        registry.register(PrefixPolicy.TYPE,    (cfg, reg) -> PrefixPolicy.fromConfig(cfg));
        registry.register(SuffixPolicy.TYPE,    (cfg, reg) -> SuffixPolicy.fromConfig(cfg));
        registry.register(RandomHexPolicy.TYPE, (cfg, reg) -> RandomHexPolicy.fromConfig(cfg, reg.environment().random()));
        registry.register(TimestampPolicy.TYPE, (cfg, reg) -> TimestampPolicy.fromConfig(cfg, reg.environment().clock()));
        registry.register(IncrementPolicy.TYPE, (cfg, reg) -> IncrementPolicy.fromConfig(cfg, reg.environment().paths()));
        registry.register(UuidPolicy.TYPE,      (cfg, reg) -> UuidPolicy.fromConfig(cfg, reg.environment().uuids()));
        registry.register(HostnamePolicy.TYPE,  (cfg, reg) -> HostnamePolicy.fromConfig(cfg, reg.environment().host()));
        registry.register(MetadataHashPolicy.TYPE,
                (cfg, reg) -> MetadataHashPolicy.fromConfig(cfg, reg.environment().hashes()));
        registry.register(CompositePolicy.TYPE, CompositePolicy::fromConfig);
    }
}

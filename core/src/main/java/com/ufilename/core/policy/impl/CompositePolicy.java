package com.ufilename.core.policy.impl;

import com.ufilename.core.policy.*;

import java.util.List;

/**
 * Runs child policies in order, each seeing the base name produced by the
 * one before it.  Children may be composites themselves.
 *
 * A child failure aborts the whole chain; nothing is written anywhere, so
 * there is no partial state to undo.
 */
public class CompositePolicy implements FilenamePolicy {

    public static final String TYPE = "composite";

    private final List<FilenamePolicy> policies;

    public CompositePolicy(List<? extends FilenamePolicy> policies) {
        this.policies = List.copyOf(policies);
    }

    public static CompositePolicy of(FilenamePolicy... policies) {
        return new CompositePolicy(List.of(policies));
    }

    /** Children are resolved through {@code registry}, so nested composites and custom types work. */
    public static CompositePolicy fromConfig(PolicyConfig config, PolicyRegistry registry) {
        return new CompositePolicy(config.getConfigList("policies").stream()
                .map(registry::resolve)
                .toList());
    }

    public List<FilenamePolicy> policies() { return policies; }

    @Override
    public String generate(NamingContext ctx) {
        NamingContext current = ctx;
        for (FilenamePolicy policy : policies) {
            current = current.withBase(policy.generate(current));
        }
        return current.base();
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public PolicyConfig toConfig() {
        return PolicyConfig.builder(TYPE)
                .putConfigs("policies", policies.stream().map(FilenamePolicy::toConfig).toList())
                .build();
    }
}

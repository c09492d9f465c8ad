package com.ufilename.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ufilename.core.env.HostIdentity;
import com.ufilename.core.env.NamingEnvironment;
import com.ufilename.core.policy.FilenamePolicy;
import com.ufilename.core.policy.PolicyRegistry;
import com.ufilename.core.service.FilenameBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot wiring for applications that depend on this library.
 *
 * Every bean backs off when the application defines its own, so a custom
 * {@link PolicyRegistry} (with extra policy types) or environment replaces
 * the defaults wholesale.  The Jackson mapper and Micrometer registry come
 * from the application context when present.
 */
@AutoConfiguration
@EnableConfigurationProperties(NamingProperties.class)
public class NamingAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(NamingAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public NamingEnvironment namingEnvironment(NamingProperties properties) {
        NamingEnvironment env = NamingEnvironment.defaults();
        if (properties.hostname() != null && !properties.hostname().isBlank()) {
            log.info("Using configured host name '{}' for filename policies", properties.hostname());
            env = env.withHost(HostIdentity.fixed(properties.hostname()));
        }
        return env;
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyRegistry policyRegistry(NamingEnvironment namingEnvironment) {
        return PolicyRegistry.newDefaultRegistry(namingEnvironment);
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyConfigCodec policyConfigCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new PolicyConfigCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public FilenameBuilder filenameBuilder(ObjectProvider<MeterRegistry> meterRegistry) {
        return new FilenameBuilder(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    /** The policy configured under {@code ufilename.default-policy}, resolved once at startup. */
    @Bean
    @ConditionalOnMissingBean(FilenamePolicy.class)
    public FilenamePolicy defaultFilenamePolicy(PolicyRegistry policyRegistry,
                                                PolicyConfigCodec policyConfigCodec,
                                                NamingProperties properties) {
        FilenamePolicy policy = policyRegistry.resolve(policyConfigCodec.read(properties.defaultPolicy()));
        log.info("Default filename policy: {}", policy.toConfig());
        return policy;
    }
}

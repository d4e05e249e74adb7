package com.auditflow.core.config;

import com.auditflow.core.cache.CacheArtifacts;
import com.auditflow.core.tools.ToolStrategies;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Infrastructure beans shared by every project workspace.
 */
@Configuration
public class AuditflowConfig {

    @Bean
    public Clock auditClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheArtifacts cacheArtifacts() {
        return new CacheArtifacts();
    }

    @Bean
    public ToolStrategies toolStrategies() {
        return ToolStrategies.defaults();
    }
}

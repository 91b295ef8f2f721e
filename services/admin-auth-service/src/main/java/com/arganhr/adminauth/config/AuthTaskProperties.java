package com.arganhr.adminauth.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** Background work of the auth flow: audit writes and last-login updates. */
@ConfigurationProperties(prefix = "admin-auth.tasks")
public record AuthTaskProperties(
    @DefaultValue("2") int corePoolSize,
    @DefaultValue("4") int maxPoolSize,
    @DefaultValue("500") int queueCapacity,
    @DefaultValue("PT3S") Duration auditWriteTimeout) {}

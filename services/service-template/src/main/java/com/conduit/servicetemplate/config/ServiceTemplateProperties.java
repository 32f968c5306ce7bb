package com.conduit.servicetemplate.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of the service, bound from {@code conduit.service.*}.
 *
 * <pre>
 * conduit:
 *   service:
 *     name: storage-authority
 *     environment: production
 *     description: Order and authorization storage
 * </pre>
 *
 * @param name service name used in logs and metrics. Required.
 * @param environment deployment environment, {@code development} when unset
 * @param description human-readable description
 */
@ConfigurationProperties(prefix = "conduit.service")
@Validated
public record ServiceTemplateProperties(@NotBlank String name, String environment, String description) {

    /** Applies defaults before Bean Validation runs. */
    public ServiceTemplateProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}

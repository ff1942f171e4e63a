package com.zeus.people.service.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of the running service, bound from {@code zeus.service.*}.
 *
 * <pre>
 * zeus:
 *   service:
 *     name: people-service
 *     environment: production
 * </pre>
 *
 * @param name tags every event store meter as {@code service}. Required.
 * @param environment deployment environment, {@code development} when unset
 * @param description free text
 */
@ConfigurationProperties(prefix = "zeus.service")
@Validated
public record PeopleServiceProperties(@NotBlank String name, String environment, String description) {

    public PeopleServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}

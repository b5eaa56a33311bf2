package com.phillippitts.livescribe.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Session lifecycle timing.
 *
 * <p>Example application.properties:
 * <pre>
 * livescribe.session.drain-timeout=5s
 * livescribe.session.shutdown-timeout=10s
 * </pre>
 *
 * @param drainTimeout    how long a stopping session waits for in-flight fragments before aborting
 *                        the upstream stream
 * @param shutdownTimeout bound on stopping every live session at process shutdown
 */
@ConfigurationProperties(prefix = "livescribe.session")
@Validated
public record SessionProperties(
        @NotNull @DefaultValue("5s") Duration drainTimeout,
        @NotNull @DefaultValue("10s") Duration shutdownTimeout
) {
}

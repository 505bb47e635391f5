package com.phillippitts.imageoptimizer.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * HTTP API options. Binds to "optimizer.http".
 *
 * @param requestTimeout cancels an optimization request that runs longer than this; zero or
 *                       negative disables the timeout
 */
@ConfigurationProperties(prefix = "optimizer.http")
public record HttpProperties(
        @DefaultValue("0s")
        Duration requestTimeout
) {

    public HttpProperties {
        if (requestTimeout == null) {
            requestTimeout = Duration.ZERO;
        }
    }

    public boolean hasTimeout() {
        return !requestTimeout.isZero() && !requestTimeout.isNegative();
    }
}

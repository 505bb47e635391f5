package com.phillippitts.imageoptimizer.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Sidecar output protocol options. Binds to "optimizer.protocol".
 *
 * @param legacyFallback when no framed payload arrives, treat the last unparsed output line as
 *                       an unframed result payload (older sidecar builds print no markers)
 */
@ConfigurationProperties(prefix = "optimizer.protocol")
public record ProtocolProperties(
        @DefaultValue("true")
        boolean legacyFallback
) {
}

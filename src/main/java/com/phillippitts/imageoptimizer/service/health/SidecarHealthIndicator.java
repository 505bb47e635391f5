package com.phillippitts.imageoptimizer.service.health;

import com.phillippitts.imageoptimizer.config.properties.SidecarProperties;
import com.phillippitts.imageoptimizer.service.warmup.WarmupController;
import com.phillippitts.imageoptimizer.service.warmup.WarmupController.WarmupStatus;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Supplier;

/**
 * Health indicator for the image sidecar.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: binary present and executable, warmup succeeded or has not run</li>
 *   <li>DEGRADED: binary present but the startup warmup failed</li>
 *   <li>DOWN: binary missing or not executable</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SidecarHealthIndicator implements HealthIndicator {

    static final String STATUS_DEGRADED = "DEGRADED";

    private final SidecarProperties properties;
    private final Supplier<WarmupStatus> warmupStatus;
    private final Supplier<String> warmupError;

    @Autowired
    public SidecarHealthIndicator(SidecarProperties properties, ObjectProvider<WarmupController> warmup) {
        this(properties,
                () -> {
                    WarmupController controller = warmup.getIfAvailable();
                    return controller == null ? WarmupStatus.NOT_RUN : controller.status();
                },
                () -> {
                    WarmupController controller = warmup.getIfAvailable();
                    return controller == null ? null : controller.lastError();
                });
    }

    SidecarHealthIndicator(SidecarProperties properties, Supplier<WarmupStatus> warmupStatus,
                           Supplier<String> warmupError) {
        this.properties = properties;
        this.warmupStatus = warmupStatus;
        this.warmupError = warmupError;
    }

    @Override
    public Health health() {
        Path binary = Paths.get(properties.binaryPath());
        boolean exists = Files.isRegularFile(binary);
        boolean executable = exists && Files.isExecutable(binary);
        WarmupStatus warmup = warmupStatus.get();

        Health.Builder builder;
        if (!executable) {
            builder = Health.down().withDetail("status", "Sidecar binary unavailable");
        } else if (warmup == WarmupStatus.FAILED) {
            builder = Health.status(STATUS_DEGRADED).withDetail("status", "Sidecar warmup failed");
            String error = warmupError.get();
            if (error != null) {
                builder.withDetail("warmupError", error);
            }
        } else {
            builder = Health.up().withDetail("status", "Sidecar ready");
        }
        return builder
                .withDetail("binary", formatBinaryStatus(exists, executable, binary))
                .withDetail("warmup", warmup.name())
                .build();
    }

    private static String formatBinaryStatus(boolean exists, boolean executable, Path path) {
        if (!exists) {
            return "NOT FOUND at " + path;
        }
        if (!executable) {
            return "not executable at " + path;
        }
        return "accessible and executable at " + path;
    }
}

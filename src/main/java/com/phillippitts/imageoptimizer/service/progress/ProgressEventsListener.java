package com.phillippitts.imageoptimizer.service.progress;

import com.phillippitts.imageoptimizer.domain.BatchProgressEvent;
import com.phillippitts.imageoptimizer.domain.ProgressEvent;
import com.phillippitts.imageoptimizer.domain.ProgressType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs progress published on the event bus. Per-file lines go to DEBUG; task errors go to WARN,
 * throttled per distinct message so a failing batch does not flood the log.
 */
@Component
class ProgressEventsListener {

    private static final Logger LOG = LogManager.getLogger(ProgressEventsListener.class);
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    @EventListener
    void onProgress(ProgressEvent e) {
        if (e.type() == ProgressType.ERROR) {
            String error = e.error() == null ? "unknown error" : e.error();
            if (shouldLog(error)) {
                LOG.warn("Task failed: task={}, error={}", e.taskId(), error);
            }
            return;
        }
        if (e.formattedMessage() != null) {
            LOG.debug(e.formattedMessage());
        } else {
            LOG.trace("Progress: type={}, task={}, {}% ({}/{})",
                    e.type(), e.taskId(), e.percentage(), e.completedTasks(), e.totalTasks());
        }
    }

    @EventListener
    void onBatchProgress(BatchProgressEvent e) {
        LOG.info("Batch progress: {}% ({}/{}), status={}", e.percentage(), e.completed(), e.total(), e.status());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}

package com.phillippitts.imageoptimizer.service.progress;

import com.phillippitts.imageoptimizer.domain.BatchProgressEvent;
import com.phillippitts.imageoptimizer.domain.ProgressEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Default {@link ProgressListener} that republishes every event on the Spring event bus, where
 * {@code @EventListener} beans (UI bridges, loggers) pick them up.
 */
@Component
public class ApplicationEventProgressPublisher implements ProgressListener {

    private final ApplicationEventPublisher publisher;

    public ApplicationEventProgressPublisher(ApplicationEventPublisher publisher) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public void onProgress(ProgressEvent event) {
        publisher.publishEvent(event);
    }

    @Override
    public void onBatchProgress(BatchProgressEvent event) {
        publisher.publishEvent(event);
    }
}

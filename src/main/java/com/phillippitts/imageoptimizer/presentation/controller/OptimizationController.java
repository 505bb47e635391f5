package com.phillippitts.imageoptimizer.presentation.controller;

import com.phillippitts.imageoptimizer.config.properties.HttpProperties;
import com.phillippitts.imageoptimizer.domain.BenchmarkResult;
import com.phillippitts.imageoptimizer.domain.ImageTask;
import com.phillippitts.imageoptimizer.domain.OptimizationResult;
import com.phillippitts.imageoptimizer.exception.ValidationException;
import com.phillippitts.imageoptimizer.service.CancellationToken;
import com.phillippitts.imageoptimizer.service.orchestration.ImageOptimizationService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * HTTP front door for local callers: optimize a list of images or benchmark the pipeline.
 * Errors are mapped by {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/images")
class OptimizationController {

    private static final Logger LOG = LogManager.getLogger(OptimizationController.class);

    private final ImageOptimizationService optimizationService;
    private final HttpProperties httpProperties;
    private final ThreadPoolTaskScheduler timeoutScheduler;

    OptimizationController(ImageOptimizationService optimizationService,
                           HttpProperties httpProperties,
                           @Qualifier("timeoutScheduler") ThreadPoolTaskScheduler timeoutScheduler) {
        this.optimizationService = optimizationService;
        this.httpProperties = httpProperties;
        this.timeoutScheduler = timeoutScheduler;
    }

    @PostMapping("/optimize")
    ResponseEntity<List<OptimizationResult>> optimize(@RequestBody List<ImageTaskRequest> request) {
        List<ImageTask> tasks = toTasks(request);
        LOG.info("Optimize request: images={}", tasks.size());
        try (CancellationToken token = requestToken()) {
            return ResponseEntity.ok(optimizationService.optimize(tasks, token));
        }
    }

    @PostMapping("/benchmark")
    ResponseEntity<BenchmarkResult> benchmark(@RequestBody List<ImageTaskRequest> request) {
        List<ImageTask> tasks = toTasks(request);
        LOG.info("Benchmark request: images={}", tasks.size());
        return ResponseEntity.ok(optimizationService.runBenchmark(tasks));
    }

    private CancellationToken requestToken() {
        if (!httpProperties.hasTimeout()) {
            return CancellationToken.create();
        }
        return CancellationToken.cancelAfter(httpProperties.requestTimeout(), timeoutScheduler.getScheduledExecutor());
    }

    private static List<ImageTask> toTasks(List<ImageTaskRequest> request) {
        if (request == null) {
            throw new ValidationException("request body must be a JSON array of tasks");
        }
        List<ImageTask> tasks = new ArrayList<>(request.size());
        for (int i = 0; i < request.size(); i++) {
            ImageTaskRequest entry = request.get(i);
            if (entry == null) {
                throw new ValidationException("task at index " + i + " is null");
            }
            tasks.add(entry.toTask());
        }
        return tasks;
    }
}

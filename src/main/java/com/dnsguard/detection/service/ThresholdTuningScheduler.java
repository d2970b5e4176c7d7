package com.dnsguard.detection.service;

import com.dnsguard.detection.config.AdaptiveThresholdConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs the threshold evaluation tick every {@code checkIntervalMinutes}, first tick one
 * interval after start. Stopping cancels the future between ticks; a tick in flight finishes
 * its commit because the controller applies changes under its own lock.
 */
@Component
public class ThresholdTuningScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ThresholdTuningScheduler.class);

    private final ThresholdTuningService tuningService;
    private final TaskScheduler taskScheduler;
    private final AdaptiveThresholdConfig config;
    private final Clock clock;

    private volatile ScheduledFuture<?> future;

    public ThresholdTuningScheduler(ThresholdTuningService tuningService,
                                    TaskScheduler taskScheduler,
                                    AdaptiveThresholdConfig config,
                                    Clock clock) {
        this.tuningService = tuningService;
        this.taskScheduler = taskScheduler;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (future != null) {
            return;
        }
        if (!config.isTuningEnabled()) {
            log.info("Adaptive threshold tuning is disabled");
            return;
        }
        Duration interval = Duration.ofMinutes(config.getCheckIntervalMinutes());
        future = taskScheduler.scheduleWithFixedDelay(this::tick, clock.instant().plus(interval), interval);
        log.info("Starting continuous threshold monitoring (check every {} min)", config.getCheckIntervalMinutes());
    }

    @Override
    public synchronized void stop() {
        if (future != null) {
            future.cancel(false);
            future = null;
            log.info("Stopped threshold monitoring");
        }
    }

    @Override
    public boolean isRunning() {
        return future != null;
    }

    void tick() {
        try {
            tuningService.runTuningCycle();
        } catch (RuntimeException e) {
            // keep the schedule alive; accumulated scores and feedback are untouched
            log.error("Error in threshold tuning cycle", e);
        }
    }
}

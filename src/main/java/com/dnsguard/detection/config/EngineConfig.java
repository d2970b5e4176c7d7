package com.dnsguard.detection.config;

import com.dnsguard.detection.engine.scoring.OutlierModelFactory;
import com.dnsguard.detection.engine.scoring.RandomCutForestOutlierModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OutlierModelFactory outlierModelFactory(DetectionConfig config) {
        DetectionConfig.Forest forest = config.getForest();
        return () -> new RandomCutForestOutlierModel(
                forest.getNumberOfTrees(), forest.getSampleSize(), forest.getRandomSeed());
    }

    @Bean
    public TaskScheduler detectionTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("detection-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}

package com.project.scratch.analysis.config;

import com.project.scratch.analysis.service.BrightnessWeighting;
import com.project.scratch.analysis.service.LinearBrightnessWeighting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Beans shared by the analysis pipeline: the brightness weighting used for scratch indices
 * and the worker pool that analyzes images of a full recalculation in parallel.
 */
@Configuration
public class AnalysisConfig {
    private static final Logger log = LoggerFactory.getLogger(AnalysisConfig.class);

    @Bean
    public BrightnessWeighting brightnessWeighting() {
        return new LinearBrightnessWeighting();
    }

    /** {@code app.analysis.worker-threads <= 0} means one thread per available processor. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService analysisExecutor(@Value("${app.analysis.worker-threads:0}") int workerThreads) {
        int threads = workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("scratch-worker-");
        threadFactory.setDaemon(true);
        log.info("Create analysis pool with {} worker threads", threads);
        return Executors.newFixedThreadPool(threads, threadFactory);
    }
}

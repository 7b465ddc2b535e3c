package com.autolog.ops.DailyReportService.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class ReportExecutorConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportExecutorConfig.class);

    @Bean(name = "ownerReportExecutor")
    public TaskExecutor ownerReportExecutor(DailyReportProperties dailyReportProperties) {
        DailyReportProperties.Executor settings = dailyReportProperties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getPoolSize());
        executor.setMaxPoolSize(settings.getPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("Owner-Report-");
        executor.setTaskDecorator(new LoggingTaskDecorator());
        // a full queue runs the owner on the submitting thread instead of dropping it
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(settings.getAwaitTerminationSeconds());
        executor.initialize();
        LOGGER.info("Owner report executor wired with PoolSize: {}, QueueCapacity: {}",
                executor.getCorePoolSize(), settings.getQueueCapacity());
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

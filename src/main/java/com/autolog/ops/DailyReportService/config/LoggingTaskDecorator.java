package com.autolog.ops.DailyReportService.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskDecorator;

import java.time.Duration;
import java.time.Instant;

public class LoggingTaskDecorator implements TaskDecorator {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingTaskDecorator.class);

    @Override
    public Runnable decorate(Runnable runnable) {
        String submissionThreadName = Thread.currentThread().getName();
        LOGGER.debug("Owner report task submitted from thread {}", submissionThreadName);

        return () -> {
            String executionThreadName = Thread.currentThread().getName();
            Instant startTime = Instant.now();
            LOGGER.debug(">>> Owner report task start | thread={} | submittedBy={}", executionThreadName, submissionThreadName);
            try {
                runnable.run();
            } finally {
                LOGGER.debug("<<< Owner report task finish | thread={} | duration={} ms",
                        executionThreadName, Duration.between(startTime, Instant.now()).toMillis());
            }
        };
    }
}

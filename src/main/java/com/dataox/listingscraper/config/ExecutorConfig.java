package com.dataox.listingscraper.config;

import com.dataox.listingscraper.service.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;

import java.time.Clock;

@Configuration
public class ExecutorConfig {

    public static final String SCRAPE_EXECUTOR = "scrapeJobExecutor";

    /**
     * One thread per submitted job, no upper bound on concurrent jobs.
     */
    @Bean(name = SCRAPE_EXECUTOR)
    public TaskExecutor scrapeJobExecutor() {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("scrape-job-");
        executor.setDaemon(false);
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }
}

package org.example.aipacs.config;

import org.example.aipacs.service.impl.JobWorkQueue;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "jobExecutor")
    public ThreadPoolTaskExecutor jobExecutor(PipelineProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getWorkers().getCount());
        executor.setMaxPoolSize(props.getWorkers().getCount());
        executor.setQueueCapacity(props.getWorkers().getQueueCapacity());
        executor.setThreadNamePrefix("job-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    // engine exchanges run here so a worker can give up on a call at its deadline
    @Bean(name = "engineCallExecutor")
    public ThreadPoolTaskExecutor engineCallExecutor(PipelineProperties props) {
        int workers = props.getWorkers().getCount();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers * 2);
        executor.setQueueCapacity(workers);
        executor.setThreadNamePrefix("engine-call-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public JobWorkQueue jobWorkQueue(@Qualifier("jobExecutor") ThreadPoolTaskExecutor jobExecutor, PipelineProperties props) {
        return new JobWorkQueue(jobExecutor, props.getWorkers().getQueueCapacity());
    }

    @Bean(name = "pipelineScheduler")
    public TaskScheduler pipelineScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("pipeline-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}

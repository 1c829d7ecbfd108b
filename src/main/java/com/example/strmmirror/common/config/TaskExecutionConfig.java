package com.example.strmmirror.common.config;

import com.example.strmmirror.common.util.NamedThreadFactory;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class TaskExecutionConfig {

    private ExecutorService mirrorTaskExecutor;

    @Bean
    public ExecutorService mirrorTaskExecutor(AppMirrorProperties appMirrorProperties) {
        int core = Math.max(1, appMirrorProperties.getRunnerThreadCount());
        int queueSize = Math.max(1, appMirrorProperties.getRunnerQueueSize());
        this.mirrorTaskExecutor = new ThreadPoolExecutor(
                core,
                core,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueSize),
                new NamedThreadFactory("mirror-task-"),
                new ThreadPoolExecutor.AbortPolicy());
        return this.mirrorTaskExecutor;
    }

    @Bean
    public ThreadPoolTaskScheduler mirrorTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("mirror-cron-");
        // non-daemon: keeps the process alive between scheduled passes
        scheduler.setDaemon(false);
        return scheduler;
    }

    @PreDestroy
    public void shutdown() {
        if (mirrorTaskExecutor != null) {
            mirrorTaskExecutor.shutdownNow();
        }
    }
}

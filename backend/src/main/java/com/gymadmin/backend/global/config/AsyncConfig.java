package com.gymadmin.backend.global.config;

import com.gymadmin.backend.modules.audit.application.AuditProperties;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for audit writes. The queue is bounded; a full queue drops the record rather than blocking requests.
 */
@Configuration
public class AsyncConfig {

    public static final String AUDIT_TASK_EXECUTOR = "auditTaskExecutor";

    @Bean(name = AUDIT_TASK_EXECUTOR)
    public ThreadPoolTaskExecutor auditTaskExecutor(AuditProperties auditProperties) {
        AuditProperties.Executor settings = auditProperties.executor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("audit-");
        executor.setCorePoolSize(settings.coreSize());
        executor.setMaxPoolSize(settings.maxSize());
        executor.setQueueCapacity(settings.queueCapacity());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}

package dev.quantumreview.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Map;

/**
 * Async execution configuration.
 *
 * <p>The job executor only backs the in-process queue used by the {@code local} profile;
 * in every other profile jobs arrive through the SQS listener container. Either way the
 * MDC of the submitting thread (deliveryId, jobType) follows the task so log lines of a
 * job can be correlated with the webhook delivery that produced it.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "jobTaskExecutor")
    public ThreadPoolTaskExecutor jobTaskExecutor(JobProperties jobProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setTaskDecorator(new MdcPropagatingTaskDecorator());
        executor.setCorePoolSize(jobProperties.localConcurrency());
        executor.setMaxPoolSize(jobProperties.localConcurrency());
        executor.setQueueCapacity(1_000);
        executor.setThreadNamePrefix("job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Copies the caller's MDC into the worker thread and clears it afterwards.
     */
    static class MdcPropagatingTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }
}

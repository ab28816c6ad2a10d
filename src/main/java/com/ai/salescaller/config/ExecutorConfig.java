package com.ai.salescaller.config;

import com.ai.salescaller.service.dispatch.ShedOldestPolicy;
import com.ai.salescaller.service.dispatch.Sleeper;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for provider calls: speech requests made on behalf of a webhook, and outcome
 * dispatch after the call.
 */
@Configuration
public class ExecutorConfig {

    /**
     * Runs TTS/STT requests so the webhook thread can stop waiting at {@code speech.provider-timeout}.
     *
     * <p>Rejection policy is abort: a saturated pool counts as a transient provider failure and the
     * adapter moves on to the next provider or the degraded prompt, rather than running the request
     * on the webhook thread without a timeout.
     */
    @Bean(name = "speechExecutor")
    public ThreadPoolTaskExecutor speechExecutor(SpeechProperties properties) {
        int threads = Math.max(2, properties.getExecutorThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(threads * 4);
        executor.setThreadNamePrefix("speech-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Delivers finished-call outcomes off the webhook threads. {@code dispatch.workers} threads over a
     * {@code dispatch.queue-capacity} queue; a full queue sheds its oldest job instead of blocking.
     * Queued jobs get up to 10 seconds to finish at shutdown.
     */
    @Bean(name = "dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor(DispatchProperties properties, ShedOldestPolicy shedOldestPolicy) {
        int workers = Math.max(1, properties.getWorkers());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Math.max(1, properties.getQueueCapacity()));
        executor.setThreadNamePrefix("dispatch-");
        executor.setRejectedExecutionHandler(shedOldestPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    @Bean
    public ShedOldestPolicy shedOldestPolicy() {
        return new ShedOldestPolicy();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    /** Copies the submitting thread's MDC (callSid) onto the worker for the duration of the task. */
    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    }
                }
            };
        };
    }
}

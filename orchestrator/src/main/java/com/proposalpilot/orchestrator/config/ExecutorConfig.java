package com.proposalpilot.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools of the pipeline.
 *
 * Fixed pools rather than @Async so concurrency stays capped:
 *   runDrivers        one thread per active run (the coordinator loop)
 *   agentWorkers      agent tasks, shared by all runs (max-parallelism)
 *   toolCallExecutor  blocking provider calls; unbounded, every call has a deadline
 *   pipelineScheduler call deadlines, retry backoff and the retention sweep
 */
@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService runDrivers(PipelineProperties props) {
        return Executors.newFixedThreadPool(props.maxConcurrentRuns(), named("run-driver"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentWorkers(PipelineProperties props) {
        return Executors.newFixedThreadPool(props.maxParallelism(), named("agent-worker"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolCallExecutor() {
        return Executors.newCachedThreadPool(named("tool-call"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService pipelineScheduler() {
        return Executors.newScheduledThreadPool(2, named("pipeline-timer"));
    }

    static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}

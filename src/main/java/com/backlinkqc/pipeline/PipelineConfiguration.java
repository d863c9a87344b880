package com.backlinkqc.pipeline;

import com.backlinkqc.audit.AuditSink;
import com.backlinkqc.audit.AuditTrail;
import com.backlinkqc.audit.InMemoryAuditLog;
import com.backlinkqc.order.OrderStateMachine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PipelineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OrderStateMachine orderStateMachine(Clock clock) {
        return new OrderStateMachine(clock);
    }

    @Bean
    public InMemoryAuditLog inMemoryAuditLog() {
        return new InMemoryAuditLog();
    }

    @Bean
    public AuditTrail auditTrail(List<AuditSink> sinks, Clock clock) {
        return new AuditTrail(sinks, clock);
    }

    /**
     * Whole orders run here; collector calls use their own pool so workers
     * never starve them. The queue is bounded and a full queue rejects.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService batchWorkers(BatchProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return new ThreadPoolExecutor(
            properties.workerThreads(),
            properties.workerThreads(),
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(properties.queueCapacity()),
            r -> {
                Thread t = new Thread(r, "batch-worker-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            },
            new ThreadPoolExecutor.AbortPolicy());
    }
}

package com.backlinkqc.pipeline;

import com.backlinkqc.contract.ErrorKind;
import com.backlinkqc.contract.PlanningException;
import com.backlinkqc.order.OrderLifecycleState;
import com.backlinkqc.order.OrderRecord;
import com.backlinkqc.qc.ReportStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs many orders on a bounded worker pool. Each order's full pipeline is
 * one unit of work and commits on its own; one failing order never rolls
 * back another. Orders the full worker queue cannot take are skipped.
 */
@Service
public class BatchPipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchPipelineRunner.class);

    static final String MDC_ORDER_ID = "orderId";

    private final OrderPipelineService pipeline;
    private final ExecutorService workers;
    private final BatchProperties properties;

    public BatchPipelineRunner(OrderPipelineService pipeline,
                               @Qualifier("batchWorkers") ExecutorService workers,
                               BatchProperties properties) {
        this.pipeline = pipeline;
        this.workers = workers;
        this.properties = properties;
    }

    public BatchResult runAll(List<String> orderIds) {
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(orderIds));
        List<Future<OrderRunResult>> futures = new ArrayList<>();
        for (String orderId : distinct) {
            try {
                futures.add(workers.submit(() -> runOne(orderId)));
            } catch (RejectedExecutionException ex) {
                log.warn("Order {} rejected, batch worker queue is full", orderId);
                futures.add(CompletableFuture.completedFuture(new OrderRunResult(orderId,
                    OrderRunResult.Outcome.SKIPPED, null, null, "worker queue full")));
            }
        }
        List<OrderRunResult> results = new ArrayList<>();
        for (int i = 0; i < distinct.size(); i++) {
            results.add(await(distinct.get(i), futures.get(i)));
        }
        BatchResult batch = new BatchResult(results);
        log.info("Batch finished orders={} completed={} failed={} skipped={} timedOut={}", results.size(),
            batch.count(OrderRunResult.Outcome.COMPLETED), batch.count(OrderRunResult.Outcome.FAILED),
            batch.count(OrderRunResult.Outcome.SKIPPED), batch.count(OrderRunResult.Outcome.TIMED_OUT));
        return batch;
    }

    OrderRunResult runOne(String orderId) {
        MDC.put(MDC_ORDER_ID, orderId);
        try {
            OrderRecord record = pipeline.run(orderId);
            ReportStatus status = record.latestReport() == null ? null : record.latestReport().status();
            if (record.state() == OrderLifecycleState.FAILED) {
                return new OrderRunResult(orderId, OrderRunResult.Outcome.FAILED, record.state(), status,
                    record.failureReason());
            }
            return new OrderRunResult(orderId, OrderRunResult.Outcome.COMPLETED, record.state(), status, null);
        } catch (PlanningException ex) {
            if (ex.getKind() == ErrorKind.ORDER_LOCKED) {
                log.info("Order {} skipped: {}", orderId, ex.getMessage());
                return new OrderRunResult(orderId, OrderRunResult.Outcome.SKIPPED, null, null, ex.getMessage());
            }
            log.warn("Order {} failed: {} {}", orderId, ex.getKind(), ex.getMessage());
            return new OrderRunResult(orderId, OrderRunResult.Outcome.FAILED, null, null,
                ex.getKind() + ": " + ex.getMessage());
        } finally {
            MDC.remove(MDC_ORDER_ID);
        }
    }

    private OrderRunResult await(String orderId, Future<OrderRunResult> future) {
        try {
            return future.get(properties.orderTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            pipeline.requestStop(orderId);
            log.warn("Order {} did not finish within {}ms, stop requested", orderId, properties.orderTimeoutMs());
            return afterStop(orderId, future);
        } catch (ExecutionException ex) {
            return crashed(orderId, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return new OrderRunResult(orderId, OrderRunResult.Outcome.FAILED, null, null, "interrupted");
        }
    }

    /**
     * Waits for a run that was asked to stop. Steps are bounded by the
     * collector timeout, so the wait ends at the next step boundary and the
     * reported state is the one the run committed.
     */
    private OrderRunResult afterStop(String orderId, Future<OrderRunResult> future) {
        try {
            OrderRunResult finished = future.get();
            if (finished.state() == null) {
                return finished;
            }
            return new OrderRunResult(orderId, OrderRunResult.Outcome.TIMED_OUT, finished.state(),
                finished.reportStatus(), "timed out, stopped in " + finished.state());
        } catch (ExecutionException ex) {
            return crashed(orderId, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return new OrderRunResult(orderId, OrderRunResult.Outcome.FAILED, null, null, "interrupted");
        }
    }

    private static OrderRunResult crashed(String orderId, ExecutionException ex) {
        log.error("Order {} crashed", orderId, ex.getCause());
        return new OrderRunResult(orderId, OrderRunResult.Outcome.FAILED, null, null,
            String.valueOf(ex.getCause().getMessage()));
    }
}

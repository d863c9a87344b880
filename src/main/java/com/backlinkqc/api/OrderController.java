package com.backlinkqc.api;

import com.backlinkqc.contract.ContractViolationException;
import com.backlinkqc.order.Order;
import com.backlinkqc.order.OrderLifecycleState;
import com.backlinkqc.order.OrderRecord;
import com.backlinkqc.pipeline.BatchPipelineRunner;
import com.backlinkqc.pipeline.BatchResult;
import com.backlinkqc.pipeline.DeliveryReceipt;
import com.backlinkqc.pipeline.OrderPipelineService;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/orders")
public class OrderController {

    private final OrderPipelineService pipeline;
    private final BatchPipelineRunner batchRunner;

    public OrderController(OrderPipelineService pipeline, BatchPipelineRunner batchRunner) {
        this.pipeline = pipeline;
        this.batchRunner = batchRunner;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public OrderRecord register(@RequestBody Order order) {
        return pipeline.register(order);
    }

    @GetMapping("/{orderId}")
    public OrderRecord get(@PathVariable String orderId) {
        return pipeline.get(orderId);
    }

    @PostMapping("/{orderId}/transitions")
    public OrderRecord transition(@PathVariable String orderId, @RequestBody TransitionRequest request) {
        if (request.targetState() == null) {
            throw new ContractViolationException("target_state is required");
        }
        String reason = request.reason() == null ? "requested via API" : request.reason();
        return pipeline.transition(orderId, request.targetState(), reason);
    }

    @PostMapping("/{orderId}/run")
    public OrderRecord run(@PathVariable String orderId) {
        return pipeline.run(orderId);
    }

    @PostMapping("/{orderId}/drafts")
    public OrderRecord submitDraft(@PathVariable String orderId, @RequestBody DraftRequest request) {
        return pipeline.submitDraft(orderId, request.articleText());
    }

    @PostMapping("/{orderId}/stop")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> stop(@PathVariable String orderId) {
        pipeline.get(orderId);
        String status = pipeline.requestStop(orderId) ? "stop_requested" : "not_running";
        return Map.of("status", status, "order_id", orderId);
    }

    @PostMapping("/{orderId}/deliver")
    public DeliveryReceipt deliver(@PathVariable String orderId) {
        return pipeline.deliver(orderId);
    }

    @PostMapping("/batch")
    public BatchResult runBatch(@RequestBody BatchRequest request) {
        if (request.orderIds() == null || request.orderIds().isEmpty()) {
            throw new ContractViolationException("order_ids must contain at least 1 order id");
        }
        return batchRunner.runAll(request.orderIds());
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record TransitionRequest(OrderLifecycleState targetState, String reason) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record DraftRequest(String articleText) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record BatchRequest(List<String> orderIds) {}
}

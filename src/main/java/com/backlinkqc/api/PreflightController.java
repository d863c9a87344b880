package com.backlinkqc.api;

import com.backlinkqc.order.Order;
import com.backlinkqc.pipeline.PreflightService;
import com.backlinkqc.preflight.PreflightMatrix;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/preflight")
public class PreflightController {

    private final PreflightService preflightService;

    public PreflightController(PreflightService preflightService) {
        this.preflightService = preflightService;
    }

    @PostMapping
    public PreflightMatrix build(@RequestBody Order order) {
        return preflightService.buildPreflight(order);
    }
}

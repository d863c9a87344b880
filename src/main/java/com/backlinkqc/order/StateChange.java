package com.backlinkqc.order;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StateChange(OrderLifecycleState from, OrderLifecycleState to, String reason, Instant at) {}

package com.backlinkqc.pipeline;

import com.backlinkqc.order.OrderRecord;
import com.backlinkqc.portfolio.PortfolioDelta;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * @param portfolioDelta risk change caused by the placed anchor; null when the
 *                       order had already been delivered
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryReceipt(OrderRecord order, PortfolioDelta portfolioDelta) {}

package com.backlinkqc.order;

import java.util.List;
import java.util.Optional;

public interface OrderStore {

    /** Inserts or replaces the snapshot of an order. */
    OrderRecord save(OrderRecord record);

    Optional<OrderRecord> find(String orderId);

    /**
     * Inserts the snapshot only when no order with its id is stored yet.
     *
     * @return false when an order with the same id already exists
     */
    boolean saveIfAbsent(OrderRecord record);

    List<OrderRecord> findByState(OrderLifecycleState state);
}

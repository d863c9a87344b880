package com.backlinkqc.order;

import com.backlinkqc.contract.ErrorKind;
import com.backlinkqc.contract.PlanningException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exclusive per-order leases. At most one worker holds an order at a time;
 * a lease is released by closing it.
 */
@Component
public class OrderLeaseRegistry {

    private final ConcurrentHashMap<String, String> holders = new ConcurrentHashMap<>();

    public final class Lease implements AutoCloseable {

        private final String orderId;
        private final String owner;

        private Lease(String orderId, String owner) {
            this.orderId = orderId;
            this.owner = owner;
        }

        public String orderId() {
            return orderId;
        }

        public String owner() {
            return owner;
        }

        @Override
        public void close() {
            holders.remove(orderId, owner);
        }
    }

    /**
     * @throws PlanningException of kind {@link ErrorKind#ORDER_LOCKED} when another owner holds the order
     */
    public Lease acquire(String orderId, String owner) {
        String holder = holders.putIfAbsent(orderId, owner);
        if (holder != null) {
            throw new PlanningException(ErrorKind.ORDER_LOCKED,
                "Order " + orderId + " is held by " + holder,
                Map.of("order_id", orderId, "holder", holder));
        }
        return new Lease(orderId, owner);
    }

    public boolean isHeld(String orderId) {
        return holders.containsKey(orderId);
    }

    /** Owner of the lease currently held on the order, if any. */
    public Optional<String> holder(String orderId) {
        return Optional.ofNullable(holders.get(orderId));
    }
}

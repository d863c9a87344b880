package com.backlinkqc.order;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryOrderStore implements OrderStore {

    private final ConcurrentHashMap<String, OrderRecord> orders = new ConcurrentHashMap<>();

    @Override
    public OrderRecord save(OrderRecord record) {
        orders.put(record.orderId(), record);
        return record;
    }

    @Override
    public Optional<OrderRecord> find(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public boolean saveIfAbsent(OrderRecord record) {
        return orders.putIfAbsent(record.orderId(), record) == null;
    }

    @Override
    public List<OrderRecord> findByState(OrderLifecycleState state) {
        return orders.values().stream()
            .filter(record -> record.state() == state)
            .sorted(Comparator.comparing(OrderRecord::orderId))
            .toList();
    }
}

package com.backlinkqc.order;

import com.backlinkqc.contract.ErrorKind;
import com.backlinkqc.contract.PlanningException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OrderLeaseRegistryTest {

    private final OrderLeaseRegistry leases = new OrderLeaseRegistry();

    @Test
    void secondOwnerIsLockedOutUntilRelease() {
        OrderLeaseRegistry.Lease lease = leases.acquire("ORD-L-1", "worker-a");
        assertTrue(leases.isHeld("ORD-L-1"));

        PlanningException ex = assertThrows(PlanningException.class, () -> leases.acquire("ORD-L-1", "worker-b"));
        assertEquals(ErrorKind.ORDER_LOCKED, ex.getKind());
        assertEquals("worker-a", ex.getContext().get("holder"));

        lease.close();
        assertFalse(leases.isHeld("ORD-L-1"));
        try (OrderLeaseRegistry.Lease next = leases.acquire("ORD-L-1", "worker-b")) {
            assertEquals("ORD-L-1", next.orderId());
        }
    }

    @Test
    void leasesOnDifferentOrdersAreIndependent() {
        try (OrderLeaseRegistry.Lease a = leases.acquire("ORD-L-2", "worker-a");
             OrderLeaseRegistry.Lease b = leases.acquire("ORD-L-3", "worker-a")) {
            assertTrue(leases.isHeld(a.orderId()));
            assertTrue(leases.isHeld(b.orderId()));
        }
        assertFalse(leases.isHeld("ORD-L-2"));
    }

    @Test
    void closingTwiceDoesNotReleaseAnotherOwnersLease() {
        OrderLeaseRegistry.Lease stale = leases.acquire("ORD-L-4", "worker-a");
        stale.close();
        OrderLeaseRegistry.Lease current = leases.acquire("ORD-L-4", "worker-b");

        stale.close();

        assertTrue(leases.isHeld("ORD-L-4"));
        current.close();
    }
}

package com.clapgrow.tracking.api.broadcast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SubscriberTableTest {

    private final SubscriberTable table = new SubscriberTable(2);

    @Test
    void claimsFirstFreeHandleAndRefusesWhenFull() {
        LiveSubscriber first = table.claim(this::subscriber);
        LiveSubscriber second = table.claim(this::subscriber);

        assertEquals(0, first.getHandle());
        assertEquals(1, second.getHandle());
        assertNull(table.claim(this::subscriber));
        assertEquals(2, table.size());
    }

    @Test
    void releasedHandleIsReused() {
        LiveSubscriber first = table.claim(this::subscriber);
        table.claim(this::subscriber);

        assertTrue(table.release(first));
        assertEquals(1, table.size());
        assertEquals(0, table.claim(this::subscriber).getHandle());
    }

    @Test
    void releaseOnlyFreesTheExpectedOccupant() {
        LiveSubscriber first = table.claim(this::subscriber);
        assertTrue(table.release(first));
        LiveSubscriber replacement = table.claim(this::subscriber);

        assertFalse(table.release(first));
        assertSame(replacement, table.get(0));
    }

    @Test
    void forEachVisitsOccupiedSlotsOnly() {
        table.claim(this::subscriber);
        List<Integer> handles = new ArrayList<>();

        table.forEach(s -> handles.add(s.getHandle()));

        assertEquals(List.of(0), handles);
        assertNull(table.get(1));
        assertNull(table.get(7));
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new SubscriberTable(0));
    }

    private LiveSubscriber subscriber(int handle) {
        return new LiveSubscriber(handle, UUID.randomUUID(), "tenant-1", null, new RecordingSink(), 4);
    }
}

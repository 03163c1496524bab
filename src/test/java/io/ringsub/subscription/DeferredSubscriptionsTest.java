package io.ringsub.subscription;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DeferredSubscriptionsTest {

    @Test
    void buffersUntilStartThenFlushesOnceInOrder() {
        final DeferredSubscriptions deferred = new DeferredSubscriptions();
        final List<List<String>> flushes = new ArrayList<>();

        assertTrue(deferred.offer(List.of("b", "a")));
        assertTrue(deferred.offer(List.of("c")));
        assertEquals(List.of("b", "a", "c"), deferred.pending());

        assertTrue(deferred.start(flushes::add));

        assertEquals(List.of(List.of("b", "a", "c")), flushes);
        assertEquals(DeferredSubscriptions.State.ACTIVE, deferred.state());
        assertFalse(deferred.hasPending());
    }

    @Test
    void refusesOffersOnceActive() {
        final DeferredSubscriptions deferred = new DeferredSubscriptions();
        deferred.start(types -> fail("nothing to flush"));

        assertFalse(deferred.offer(List.of("a")));
        assertFalse(deferred.hasPending());
    }

    @Test
    void secondStartIsIgnored() {
        final DeferredSubscriptions deferred = new DeferredSubscriptions();
        final List<List<String>> flushes = new ArrayList<>();
        deferred.offer(List.of("a"));

        assertTrue(deferred.start(flushes::add));
        assertFalse(deferred.start(flushes::add));

        assertEquals(1, flushes.size());
    }

    @Test
    void failedFlushStillDrainsBuffer() {
        final DeferredSubscriptions deferred = new DeferredSubscriptions();
        deferred.offer(List.of("a"));

        assertThrows(IllegalStateException.class, () -> deferred.start(types -> {
            throw new IllegalStateException("no inbox");
        }));

        assertEquals(DeferredSubscriptions.State.ACTIVE, deferred.state());
        assertFalse(deferred.hasPending());
    }

    @Test
    void rejectsNullMessageTypesWithoutPartialAppend() {
        final DeferredSubscriptions deferred = new DeferredSubscriptions();
        final List<String> withNull = new ArrayList<>();
        withNull.add("a");
        withNull.add(null);

        assertThrows(NullPointerException.class, () -> deferred.offer(withNull));
        assertFalse(deferred.hasPending());
    }
}

package io.ringsub.subscription;

import io.ringsub.exceptions.StoreException;
import io.ringsub.exceptions.StoreObjectExistsException;
import io.ringsub.exceptions.SubscriptionInitializationException;
import io.ringsub.store.script.Script;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SubscriptionStoreBootstrapperTest {

    private final FakeStoreGateway gateway = new FakeStoreGateway();
    private final SubscriptionStoreBootstrapper bootstrapper =
            new SubscriptionStoreBootstrapper(gateway, FakeStoreGateway.SCRIPTS);

    @Test
    void skipsCreateWhenStorePresent() {
        gateway.existsResult = 1;

        assertEquals(SubscriptionStoreBootstrapper.Outcome.PRESENT, bootstrapper.ensureStore());
        assertEquals(0, gateway.count(Script.SUBSCRIPTION_MANAGER_CREATE));
    }

    @Test
    void createsWhenStoreAbsent() {
        gateway.existsResult = 0;

        assertEquals(SubscriptionStoreBootstrapper.Outcome.CREATED, bootstrapper.ensureStore());
        assertTrue(gateway.created);
        assertEquals(1, gateway.count(Script.SUBSCRIPTION_MANAGER_CREATE));
    }

    @Test
    void toleratesConcurrentCreate() {
        gateway.existsResult = 0;
        gateway.createFailure = new StoreObjectExistsException("table already exists", null);

        assertEquals(SubscriptionStoreBootstrapper.Outcome.CREATED_CONCURRENTLY, bootstrapper.ensureStore());
    }

    @Test
    void otherCreateFailuresAreFatal() {
        gateway.existsResult = 0;
        final StoreException cause = new StoreException("permission denied");
        gateway.createFailure = cause;

        final SubscriptionInitializationException ex =
                assertThrows(SubscriptionInitializationException.class, bootstrapper::ensureStore);
        assertSame(cause, ex.getCause());
    }
}

package io.ringsub.subscription;

import io.ringsub.exceptions.StoreObjectExistsException;
import io.ringsub.exceptions.SubscriptionInitializationException;
import io.ringsub.store.StoreGateway;
import io.ringsub.store.query.RawQuery;
import io.ringsub.store.script.Script;
import io.ringsub.store.script.ScriptProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Makes sure the subscription table exists before anything reads or writes it.
 */
@Slf4j
@RequiredArgsConstructor
public final class SubscriptionStoreBootstrapper {

    public enum Outcome {
        /** The existence check found the table. */
        PRESENT,
        /** This bootstrapper created the table. */
        CREATED,
        /** The table was missing, but another node created it before we could. */
        CREATED_CONCURRENTLY
    }

    private final StoreGateway gateway;
    private final ScriptProvider scripts;

    /**
     * Runs the existence check and, when it does not report exactly 1, the create script.
     * A create that fails because the table is already there counts as success.
     *
     * @throws SubscriptionInitializationException if the create fails for any other reason
     */
    public Outcome ensureStore() {
        final int exists = gateway.executeScalar(
                RawQuery.create(scripts.get(Script.SUBSCRIPTION_MANAGER_EXISTS)));

        if (exists == 1) {
            log.debug("Subscription store present");
            return Outcome.PRESENT;
        }

        try {
            gateway.execute(RawQuery.create(scripts.get(Script.SUBSCRIPTION_MANAGER_CREATE)));
        } catch (final StoreObjectExistsException e) {
            log.info("Subscription store was created concurrently by another node: {}", e.getMessage());
            return Outcome.CREATED_CONCURRENTLY;
        } catch (final RuntimeException e) {
            throw new SubscriptionInitializationException("Could not create the subscription store", e);
        }

        log.info("Created subscription store");
        return Outcome.CREATED;
    }
}

package io.ringsub.subscription;

import io.ringsub.config.impl.NodeConfig;
import io.ringsub.exceptions.MissingSubscriptionException;
import io.ringsub.store.script.Script;
import io.ringsub.subscription.mode.SubscribeMode;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SubscriptionRegistrarTest {
    private static final String INBOX = "amqp://broker/orders-inbox";

    private final FakeStoreGateway gateway = new FakeStoreGateway();

    private SubscriptionRegistrar registrar(final NodeConfig node, final SubscribeMode mode) {
        return new SubscriptionRegistrar(node, mode, gateway, FakeStoreGateway.SCRIPTS);
    }

    private static NodeConfig inboxNode() {
        return NodeConfig.builder().inboxWorkQueueUri(URI.create(INBOX)).build();
    }

    @Test
    void registerUpsertsEveryTypeInOrder() {
        registrar(inboxNode(), SubscribeMode.REGISTER).subscribe(List.of("C", "A", "B"));

        assertEquals(List.of(List.of("C", INBOX), List.of("A", INBOX), List.of("B", INBOX)), gateway.inserts);
    }

    @Test
    void registerIsIdempotent() {
        final SubscriptionRegistrar registrar = registrar(inboxNode(), SubscribeMode.REGISTER);

        registrar.subscribe(List.of("A"));
        registrar.subscribe(List.of("A"));

        assertEquals(1, gateway.rows.size());
    }

    @Test
    void validateReportsOnlyMissingTypesAndWritesNothing() {
        gateway.provision("A", INBOX);
        gateway.provision("C", INBOX);

        final MissingSubscriptionException ex = assertThrows(MissingSubscriptionException.class,
                () -> registrar(inboxNode(), SubscribeMode.VALIDATE).subscribe(List.of("A", "B", "C")));

        assertEquals(List.of("B"), ex.getMissingMessageTypes());
        assertTrue(ex.getMessage().endsWith(": B"), ex.getMessage());
        assertEquals(3, gateway.count(Script.SUBSCRIPTION_MANAGER_CONTAINS));
        assertEquals(0, gateway.count(Script.SUBSCRIPTION_MANAGER_SUBSCRIBE));
        assertTrue(gateway.inserts.isEmpty());
    }

    @Test
    void validateListsAllMissingTypesCommaJoined() {
        final MissingSubscriptionException ex = assertThrows(MissingSubscriptionException.class,
                () -> registrar(inboxNode(), SubscribeMode.VALIDATE).subscribe(List.of("X", "Y")));

        assertEquals(List.of("X", "Y"), ex.getMissingMessageTypes());
        assertTrue(ex.getMessage().endsWith("X,Y"), ex.getMessage());
    }

    @Test
    void validatePassesWhenEverythingProvisioned() {
        gateway.provision("A", INBOX);

        assertDoesNotThrow(() -> registrar(inboxNode(), SubscribeMode.VALIDATE).subscribe(List.of("A")));
    }

    @Test
    void ignoreModeNeverTouchesStore() {
        final NodeConfig noInbox = NodeConfig.builder().build();

        registrar(noInbox, SubscribeMode.IGNORE).subscribe(List.of("A", "B"));

        assertTrue(gateway.queries.isEmpty());
    }

    @Test
    void workerNodesSkipRegistration() {
        final NodeConfig worker = NodeConfig.builder().worker(true).build();

        registrar(worker, SubscribeMode.REGISTER).subscribe(List.of("A"));

        assertTrue(gateway.queries.isEmpty());
    }

    @Test
    void subscribingWithoutInboxIsInvalid() {
        final NodeConfig noInbox = NodeConfig.builder().build();

        assertThrows(IllegalStateException.class,
                () -> registrar(noInbox, SubscribeMode.REGISTER).subscribe(List.of("A")));
        assertThrows(IllegalStateException.class,
                () -> registrar(noInbox, SubscribeMode.VALIDATE).subscribe(List.of("A")));
        assertTrue(gateway.queries.isEmpty());
    }
}

package io.ringsub.subscription;

import io.ringsub.bus.BusEvents;
import io.ringsub.config.impl.SubscriptionConfig;
import io.ringsub.exceptions.SubscriptionConfigException;
import io.ringsub.node.NodeCapabilities;
import io.ringsub.registry.MessageTypes;
import io.ringsub.store.StoreGateway;
import io.ringsub.store.StoreGatewayFactory;
import io.ringsub.store.impl.JdbcStoreGateway;
import io.ringsub.store.query.RawQuery;
import io.ringsub.store.query.StoreRow;
import io.ringsub.store.script.ClasspathScriptProvider;
import io.ringsub.store.script.Script;
import io.ringsub.store.script.ScriptProvider;
import io.ringsub.subscription.mode.SubscribeMode;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for subscriptions on one node.
 * <p>
 * Construction validates the store settings, opens the store and makes sure the subscription
 * table exists. Subscriptions made before the bus reports "started" are buffered and flushed
 * through the configured {@link SubscribeMode} when it does. Subscriber lookups go through a
 * cache that is filled from the store once per message type.
 */
@Slf4j
public final class SubscriptionManager {
    private final ScriptProvider scripts;
    private final StoreGateway gateway;
    private final DeferredSubscriptions deferred = new DeferredSubscriptions();
    private final SubscriptionRegistrar registrar;
    private final SubscriberCache subscribers = new SubscriberCache();

    /**
     * @throws SubscriptionConfigException if the provider name or connection string is blank
     * @throws io.ringsub.exceptions.SubscriptionInitializationException if the table cannot be created
     */
    public SubscriptionManager(final BusEvents events,
                               final NodeCapabilities node,
                               final SubscriptionConfig config,
                               final ScriptProvider scripts,
                               final StoreGatewayFactory gatewayFactory) {
        Objects.requireNonNull(events, "events");
        Objects.requireNonNull(node, "node");
        requireStoreSettings(config);
        this.scripts = Objects.requireNonNull(scripts, "scripts");
        Objects.requireNonNull(gatewayFactory, "gatewayFactory");

        this.gateway = Objects.requireNonNull(
                gatewayFactory.open(config.getProviderName(), config.getConnectionString()),
                "gatewayFactory returned null");
        this.registrar = new SubscriptionRegistrar(node, config.getSubscribeMode(), gateway, scripts);

        final SubscriptionStoreBootstrapper.Outcome outcome =
                new SubscriptionStoreBootstrapper(gateway, scripts).ensureStore();
        log.info("Subscription manager ready (provider={}, mode={}, store={})",
                config.getProviderName(), config.getSubscribeMode(), outcome);

        events.addStartedListener(this::onBusStarted);
    }

    /**
     * Builds a manager over JDBC, with scripts read from the classpath for the configured provider.
     */
    public static SubscriptionManager create(final BusEvents events,
                                             final NodeCapabilities node,
                                             final SubscriptionConfig config) {
        requireStoreSettings(config);
        return new SubscriptionManager(events, node, config,
                new ClasspathScriptProvider(config.getProviderName()), JdbcStoreGateway::new);
    }

    private static void requireStoreSettings(final SubscriptionConfig config) {
        Objects.requireNonNull(config, "config");

        if (isBlank(config.getProviderName())) {
            throw new SubscriptionConfigException("SubscriptionManager: the subscription providerName is empty");
        }
        if (isBlank(config.getConnectionString())) {
            throw new SubscriptionConfigException("SubscriptionManager: the subscription connectionString is empty");
        }
        if (config.getSubscribeMode() == null) {
            throw new SubscriptionConfigException("SubscriptionManager: the subscribe mode is not set");
        }
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }

    public void subscribe(final Collection<String> messageTypes) {
        Objects.requireNonNull(messageTypes, "messageTypes");

        if (deferred.offer(messageTypes)) return;

        registrar.subscribe(messageTypes);
    }

    public void subscribe(final String messageType) {
        subscribe(List.of(messageType));
    }

    public void subscribe(final Class<?> messageType) {
        subscribe(MessageTypes.of(messageType));
    }

    public void subscribeTypes(final Collection<? extends Class<?>> messageTypes) {
        subscribe(MessageTypes.ofTypes(messageTypes));
    }

    /**
     * Inbox URIs subscribed to the runtime type of {@code message}, as stored when this type was
     * first looked up. Never null; empty when nobody subscribes.
     */
    public List<String> getSubscribedUris(final Object message) {
        return getSubscribedUrisFor(MessageTypes.ofMessage(message));
    }

    public List<String> getSubscribedUrisFor(final String messageType) {
        return subscribers.getOrLoad(messageType, this::loadSubscribers);
    }

    public boolean hasDeferredSubscriptions() {
        return deferred.hasPending();
    }

    public DeferredSubscriptions.State state() {
        return deferred.state();
    }

    private List<String> loadSubscribers(final String messageType) {
        final List<StoreRow> rows = gateway.executeTabular(
                RawQuery.create(scripts.get(Script.SUBSCRIPTION_MANAGER_INBOX_WORK_QUEUE_URIS))
                        .addParameterValue(SubscriptionColumns.MESSAGE_TYPE, messageType));

        return rows.stream()
                .map(row -> row.getString(SubscriptionColumns.INBOX_WORK_QUEUE_URI_COLUMN))
                .toList();
    }

    private void onBusStarted() {
        deferred.start(registrar::subscribe);
    }
}

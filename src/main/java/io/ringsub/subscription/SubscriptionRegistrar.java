package io.ringsub.subscription;

import io.ringsub.exceptions.MissingSubscriptionException;
import io.ringsub.node.NodeCapabilities;
import io.ringsub.store.StoreGateway;
import io.ringsub.store.query.RawQuery;
import io.ringsub.store.script.Script;
import io.ringsub.store.script.ScriptProvider;
import io.ringsub.subscription.mode.SubscribeMode;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Binds message types to this node's inbox in the store, according to the {@link SubscribeMode}.
 * Message types are processed in the order given.
 */
@Slf4j
public final class SubscriptionRegistrar {
    private final NodeCapabilities node;
    private final SubscribeMode mode;
    private final StoreGateway gateway;
    private final ScriptProvider scripts;

    public SubscriptionRegistrar(final NodeCapabilities node,
                                 final SubscribeMode mode,
                                 final StoreGateway gateway,
                                 final ScriptProvider scripts) {
        this.node = Objects.requireNonNull(node, "node");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.scripts = Objects.requireNonNull(scripts, "scripts");
    }

    /**
     * @throws IllegalStateException        if subscriptions are required but the node has no inbox
     * @throws MissingSubscriptionException in validate mode, if any type has no row for this inbox
     */
    public void subscribe(final Collection<String> messageTypes) {
        final List<String> types = List.copyOf(Objects.requireNonNull(messageTypes, "messageTypes"));

        if (node.isWorker() || mode == SubscribeMode.IGNORE) {
            return;
        }

        final String inbox = node.hasInbox()
                ? node.getInboxWorkQueueUri().map(URI::toString).orElse(null)
                : null;
        if (inbox == null) {
            throw new IllegalStateException(
                    "Cannot subscribe to message types " + types + ": this node has no inbox work queue");
        }

        if (mode == SubscribeMode.REGISTER) {
            register(types, inbox);
        } else {
            validate(types, inbox);
        }
    }

    private void register(final List<String> types, final String inbox) {
        final String sql = scripts.get(Script.SUBSCRIPTION_MANAGER_SUBSCRIBE);

        for (final String messageType : types) {
            gateway.execute(bind(sql, inbox, messageType));
            log.debug("Subscribed {} to {}", inbox, messageType);
        }
    }

    private void validate(final List<String> types, final String inbox) {
        final String sql = scripts.get(Script.SUBSCRIPTION_MANAGER_CONTAINS);
        final List<String> missing = new ArrayList<>();

        for (final String messageType : types) {
            if (gateway.executeScalar(bind(sql, inbox, messageType)) == 0) {
                missing.add(messageType);
            }
        }

        if (missing.isEmpty()) return;

        for (final String messageType : missing) {
            log.error("Inbox {} has no subscription for message type {}", inbox, messageType);
        }
        throw new MissingSubscriptionException(missing);
    }

    private static RawQuery bind(final String sql, final String inbox, final String messageType) {
        return RawQuery.create(sql)
                .addParameterValue(SubscriptionColumns.INBOX_WORK_QUEUE_URI, inbox)
                .addParameterValue(SubscriptionColumns.MESSAGE_TYPE, messageType);
    }
}

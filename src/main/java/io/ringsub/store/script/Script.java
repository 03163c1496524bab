package io.ringsub.store.script;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The store scripts the subscription manager runs. Each maps to one resource file per provider.
 */
@Getter
@RequiredArgsConstructor
public enum Script {
    /** Scalar: 1 when the subscription table exists, anything else otherwise. */
    SUBSCRIPTION_MANAGER_EXISTS("SubscriptionManagerExists"),
    /** Creates the subscription table. */
    SUBSCRIPTION_MANAGER_CREATE("SubscriptionManagerCreate"),
    /** Upserts one (message type, inbox) row. */
    SUBSCRIPTION_MANAGER_SUBSCRIBE("SubscriptionManagerSubscribe"),
    /** Scalar: number of rows for one (message type, inbox) pair. */
    SUBSCRIPTION_MANAGER_CONTAINS("SubscriptionManagerContains"),
    /** Tabular: every inbox URI subscribed to one message type. */
    SUBSCRIPTION_MANAGER_INBOX_WORK_QUEUE_URIS("SubscriptionManagerInboxWorkQueueUris");

    private final String resourceName;
}

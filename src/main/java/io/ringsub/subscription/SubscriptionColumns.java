package io.ringsub.subscription;

/**
 * Bind parameter and result column names shared by the subscription scripts.
 */
final class SubscriptionColumns {
    static final String MESSAGE_TYPE = "MessageType";
    static final String INBOX_WORK_QUEUE_URI = "InboxWorkQueueUri";

    /* Result column; stores fold case differently, StoreRow lookups ignore it. */
    static final String INBOX_WORK_QUEUE_URI_COLUMN = "INBOX_WORK_QUEUE_URI";

    private SubscriptionColumns() {
    }
}

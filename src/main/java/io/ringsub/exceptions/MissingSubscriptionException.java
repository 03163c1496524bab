package io.ringsub.exceptions;

import lombok.Getter;

import java.util.List;

/**
 * Raised in validate mode when one or more message types have no subscription row for
 * this node's inbox. The message lists every missing type, comma separated.
 */
@Getter
public class MissingSubscriptionException extends RuntimeException {

    private final List<String> missingMessageTypes;

    public MissingSubscriptionException(final List<String> missingMessageTypes) {
        super("Missing subscriptions for message types: " + String.join(",", missingMessageTypes));
        this.missingMessageTypes = List.copyOf(missingMessageTypes);
    }
}

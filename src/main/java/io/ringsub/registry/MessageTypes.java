package io.ringsub.registry;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Derives message type names. A message type is the fully qualified runtime class name of the
 * message, so publishers and subscribers agree without sharing anything but the class.
 */
public final class MessageTypes {

    private MessageTypes() {
    }

    public static String of(final Class<?> type) {
        return Objects.requireNonNull(type, "type").getName();
    }

    public static String ofMessage(final Object message) {
        return of(Objects.requireNonNull(message, "message").getClass());
    }

    public static List<String> ofTypes(final Collection<? extends Class<?>> types) {
        Objects.requireNonNull(types, "types");
        return types.stream().map(MessageTypes::of).toList();
    }
}

package io.ringsub.config.impl;

import io.ringsub.config.type.ConfigLoader;
import io.ringsub.exceptions.SubscriptionConfigException;
import io.ringsub.subscription.mode.SubscribeMode;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.io.IOException;
import java.util.Collection;
import java.util.Map;

/**
 * Settings for the subscription store, loaded from YAML:
 * <pre>
 * providerName: org.h2.Driver
 * connectionString: jdbc:h2:mem:subscriptions
 * subscribe: register          # register | validate | ignore
 * </pre>
 * Values are not checked here; the subscription manager rejects blank ones when it is built.
 */
@Getter
@Builder
@ToString
public final class SubscriptionConfig {

    private final String providerName;
    private final String connectionString;

    @Builder.Default
    private final SubscribeMode subscribeMode = SubscribeMode.REGISTER;

    public static SubscriptionConfig load(final String path) throws IOException {
        return fromMap(ConfigLoader.readYaml(path));
    }

    public static SubscriptionConfig fromMap(final Map<String, Object> m) {
        final SubscribeMode mode;
        try {
            mode = SubscribeMode.parse((String) m.get("subscribe"));
        } catch (final IllegalArgumentException | ClassCastException e) {
            throw new SubscriptionConfigException(
                    "Unknown subscribe mode '" + m.get("subscribe") + "'; expected register, validate or ignore", e);
        }

        return SubscriptionConfig.builder()
                .providerName(scalar(m, "providerName"))
                .connectionString(scalar(m, "connectionString"))
                .subscribeMode(mode)
                .build();
    }

    /* YAML may type a scalar as a number or boolean; nested mappings and lists are rejected. */
    private static String scalar(final Map<String, Object> m, final String key) {
        final Object value = m.get(key);
        if (value == null) return null;
        if (value instanceof Map || value instanceof Collection) {
            throw new SubscriptionConfigException("Expected a scalar value for '" + key + "' but got " + value);
        }
        return String.valueOf(value);
    }
}

package io.ringsub.store.script;

import io.ringsub.exceptions.SubscriptionConfigException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads scripts from {@code scripts/<providerName>/<resourceName>.sql} on the classpath.
 * Texts are read once and cached for the life of the provider.
 */
@Slf4j
public final class ClasspathScriptProvider implements ScriptProvider {
    private static final String ROOT = "scripts";
    private static final String EXT = ".sql";

    private final String providerName;
    private final ClassLoader classLoader;
    private final Map<Script, String> cache = new ConcurrentHashMap<>();

    public ClasspathScriptProvider(final String providerName) {
        this(providerName, ClasspathScriptProvider.class.getClassLoader());
    }

    public ClasspathScriptProvider(final String providerName, final ClassLoader classLoader) {
        this.providerName = Objects.requireNonNull(providerName, "providerName");
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    @Override
    public String get(final Script script) {
        return cache.computeIfAbsent(Objects.requireNonNull(script, "script"), this::load);
    }

    String resourcePath(final Script script) {
        return ROOT + "/" + providerName + "/" + script.getResourceName() + EXT;
    }

    private String load(final Script script) {
        final String path = resourcePath(script);

        try (final InputStream in = classLoader.getResourceAsStream(path)) {
            if (in == null) {
                throw new SubscriptionConfigException(
                        "No script resource '" + path + "' for provider '" + providerName + "'");
            }
            final String text = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
            log.debug("Loaded script {} from {}", script, path);
            return text;
        } catch (final IOException e) {
            throw new SubscriptionConfigException("Failed to read script resource '" + path + "'", e);
        }
    }
}

package io.ringsub.config.type;

import io.ringsub.config.impl.NodeConfig;
import io.ringsub.config.impl.SubscriptionConfig;
import io.ringsub.exceptions.SubscriptionConfigException;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads subscription store settings from a YAML file by delegating to
     * {@link SubscriptionConfig#load(String)}.
     *
     * @param path the path to the YAML configuration file
     * @return a populated {@link SubscriptionConfig}
     * @throws IOException if the file cannot be read
     */
    public static SubscriptionConfig load(final String path) throws IOException {
        return SubscriptionConfig.load(path);
    }

    /**
     * Loads the local node's capabilities from a YAML file by delegating to
     * {@link NodeConfig#load(String)}. The node keys may live in the same file as the
     * subscription keys.
     */
    public static NodeConfig loadNode(final String path) throws IOException {
        return NodeConfig.load(path);
    }

    /**
     * Reads a YAML document whose root is a mapping. An empty document yields an empty map.
     *
     * @throws SubscriptionConfigException if the document is not valid YAML or its root is not a mapping
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> readYaml(final String path) throws IOException {
        final Yaml yaml = new Yaml();

        try (final InputStream in = Files.newInputStream(Paths.get(path))) {
            final Object root = yaml.load(in);
            if (root == null) return Map.of();
            if (!(root instanceof Map)) {
                throw new SubscriptionConfigException("Expected a YAML mapping at the root of " + path);
            }
            return (Map<String, Object>) root;
        } catch (final YAMLException e) {
            throw new SubscriptionConfigException("Malformed YAML in " + path, e);
        }
    }
}

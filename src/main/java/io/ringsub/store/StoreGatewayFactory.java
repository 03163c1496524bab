package io.ringsub.store;

/**
 * Opens a gateway for a provider / connection pair taken from subscription configuration.
 */
@FunctionalInterface
public interface StoreGatewayFactory {
    StoreGateway open(String providerName, String connectionString);
}

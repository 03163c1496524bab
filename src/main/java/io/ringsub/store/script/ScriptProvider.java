package io.ringsub.store.script;

/**
 * Supplies the query text for a {@link Script}, in the dialect of the configured store.
 */
@FunctionalInterface
public interface ScriptProvider {
    String get(Script script);
}

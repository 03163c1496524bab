package io.ringsub.store;

import io.ringsub.store.query.RawQuery;
import io.ringsub.store.query.StoreRow;

import java.util.List;

/**
 * Executes parameterized queries against the durable store that holds subscriptions.
 * Every call is synchronous. Failures surface as {@link io.ringsub.exceptions.StoreException};
 * a create against an object that is already there surfaces as
 * {@link io.ringsub.exceptions.StoreObjectExistsException}.
 */
public interface StoreGateway {

    /**
     * Runs the query and returns the first column of the first row as an int.
     * Returns 0 when the query yields no rows or a null value.
     */
    int executeScalar(RawQuery query);

    /**
     * Runs a statement that produces no result set.
     */
    void execute(RawQuery query);

    /**
     * Runs the query and returns every row, in the order the store produced them.
     */
    List<StoreRow> executeTabular(RawQuery query);
}

package com.example.catalog.application.port.out;

/**
 * Outbound port serializing multi-entity mutations across the product and
 * order stores.
 *
 * <p>At most one unit of work runs at any instant. The coordinator performs
 * no rollback: store writes applied by a unit of work before it throws
 * remain applied, so callers must validate before writing.
 */
public interface TransactionCoordinator {

    /**
     * Runs the unit of work with exclusive access to both stores.
     *
     * @param work the unit of work; receives the transaction handle to pass to store calls
     * @param <T>  the result type
     * @return whatever the unit of work returns
     * @throws IllegalStateException if the calling thread is already inside a unit of work
     */
    <T> T runExclusive(UnitOfWork<T> work);
}

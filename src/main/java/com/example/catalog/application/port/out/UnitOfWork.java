package com.example.catalog.application.port.out;

/**
 * A bounded sequence of store reads and writes executed under exclusivity.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface UnitOfWork<T> {

    T execute(Transaction tx);
}

package com.example.catalog.application.port.out;

import java.time.Instant;

/**
 * Handle proving that the caller currently holds store exclusivity.
 *
 * <p>Handles are issued by {@link TransactionCoordinator#runExclusive(UnitOfWork)}
 * and are only valid on the issuing thread until the unit of work returns.
 * Store operations that accept a handle skip their own locking; passing a
 * handle that is no longer active is a programming error and fails with
 * {@link IllegalStateException}.
 */
public interface Transaction {

    /**
     * Sequence number of this unit of work, for logging.
     */
    long id();

    /**
     * Instant at which exclusivity was acquired. Used as the transaction time
     * for records created inside the unit of work.
     */
    Instant startedAt();

    /**
     * Whether the unit of work that received this handle is still running.
     */
    boolean isActive();
}

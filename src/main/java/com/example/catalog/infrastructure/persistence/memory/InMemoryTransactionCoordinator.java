package com.example.catalog.infrastructure.persistence.memory;

import com.example.catalog.application.port.out.TransactionCoordinator;
import com.example.catalog.application.port.out.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Transaction coordinator for the in-memory stores.
 *
 * <p>Holds the exclusive side of {@link InMemoryStoreLock} for the whole unit
 * of work. Nothing is rolled back when the unit of work throws; the exception
 * is rethrown unchanged.
 */
@Component
public class InMemoryTransactionCoordinator implements TransactionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTransactionCoordinator.class);

    private final InMemoryStoreLock storeLock;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong committed = new AtomicLong();
    private final AtomicLong aborted = new AtomicLong();

    public InMemoryTransactionCoordinator(InMemoryStoreLock storeLock, Clock clock) {
        this.storeLock = storeLock;
        this.clock = clock;
    }

    @Override
    public <T> T runExclusive(UnitOfWork<T> work) {
        Objects.requireNonNull(work, "UnitOfWork cannot be null");

        storeLock.acquireExclusive();
        MemoryTransaction tx = new MemoryTransaction(sequence.incrementAndGet(), clock.instant());
        long start = System.nanoTime();
        log.debug("Transaction {} started", tx.id());
        try {
            T result = work.execute(tx);
            committed.incrementAndGet();
            log.debug("Transaction {} completed in {} µs", tx.id(), elapsedMicros(start));
            return result;
        } catch (RuntimeException e) {
            aborted.incrementAndGet();
            log.debug("Transaction {} aborted after {} µs: {}", tx.id(), elapsedMicros(start), e.toString());
            throw e;
        } finally {
            tx.deactivate();
            storeLock.releaseExclusive();
        }
    }

    /**
     * Number of units of work that returned normally.
     */
    public long getCommittedCount() {
        return committed.get();
    }

    /**
     * Number of units of work that ended with an exception.
     */
    public long getAbortedCount() {
        return aborted.get();
    }

    private static long elapsedMicros(long startNanos) {
        return TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - startNanos);
    }
}

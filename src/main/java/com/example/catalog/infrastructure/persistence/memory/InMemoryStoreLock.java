package com.example.catalog.infrastructure.persistence.memory;

import com.example.catalog.application.port.out.Transaction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * The single process-wide lock guarding both in-memory stores.
 *
 * <p>Store calls made without a transaction take the shared side for reads
 * and the exclusive side for writes. Store calls made with a transaction
 * only verify that the handle is active and that the calling thread owns the
 * exclusive side.
 */
@Component
public class InMemoryStoreLock {

    private final ReentrantReadWriteLock lock;

    public InMemoryStoreLock(@Value("${catalog.store.fair-lock:false}") boolean fair) {
        this.lock = new ReentrantReadWriteLock(fair);
    }

    /**
     * Runs a read action, under the shared lock unless a transaction is given.
     */
    public <T> T read(Transaction tx, Supplier<T> action) {
        if (tx != null) {
            requireOwnedBy(tx);
            return action.get();
        }
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs a write action, under the exclusive lock unless a transaction is given.
     */
    public <T> T write(Transaction tx, Supplier<T> action) {
        if (tx != null) {
            requireOwnedBy(tx);
            return action.get();
        }
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Blocks until exclusivity is acquired. Units of work do not nest.
     *
     * @throws IllegalStateException if the calling thread already holds either side of the lock
     */
    void acquireExclusive() {
        if (lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("A transaction is already running on this thread");
        }
        if (lock.getReadHoldCount() > 0) {
            throw new IllegalStateException("Cannot start a transaction while holding the shared lock");
        }
        lock.writeLock().lock();
    }

    void releaseExclusive() {
        lock.writeLock().unlock();
    }

    public boolean isHeldExclusivelyByCurrentThread() {
        return lock.isWriteLockedByCurrentThread();
    }

    private void requireOwnedBy(Transaction tx) {
        if (!tx.isActive() || !lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("Transaction " + tx.id() + " is not active on this thread");
        }
    }
}

package com.example.catalog.infrastructure.persistence.memory;

import com.example.catalog.application.port.out.Transaction;

import java.time.Instant;

/**
 * Transaction handle issued by {@link InMemoryTransactionCoordinator}.
 * Active only on the issuing thread and only until the unit of work returns.
 */
final class MemoryTransaction implements Transaction {

    private final long id;
    private final Instant startedAt;
    private final Thread owner;
    private volatile boolean active = true;

    MemoryTransaction(long id, Instant startedAt) {
        this.id = id;
        this.startedAt = startedAt;
        this.owner = Thread.currentThread();
    }

    @Override
    public long id() {
        return id;
    }

    @Override
    public Instant startedAt() {
        return startedAt;
    }

    @Override
    public boolean isActive() {
        return active && Thread.currentThread() == owner;
    }

    void deactivate() {
        active = false;
    }

    @Override
    public String toString() {
        return "Transaction{" +
                "id=" + id +
                ", startedAt=" + startedAt +
                ", active=" + active +
                '}';
    }
}

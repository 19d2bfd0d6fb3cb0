package com.namehub.service;

import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes registry mutations. Each unit of work runs under one process-wide lock and inside
 * its own transaction, and the lock is held until that transaction has committed or rolled back.
 * Work submitted here must not call the external ledger.
 */
@Component
public class RegistryMutationExecutor {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;

    public RegistryMutationExecutor(TransactionTemplate transactionTemplate) {
        this.transactionTemplate = transactionTemplate;
    }

    public <T> T execute(Supplier<T> work) {
        lock.lock();
        try {
            return transactionTemplate.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable work) {
        execute(() -> {
            work.run();
            return null;
        });
    }
}

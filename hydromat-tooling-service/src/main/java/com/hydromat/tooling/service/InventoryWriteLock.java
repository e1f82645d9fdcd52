package com.hydromat.tooling.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes writes that read one tool set and then write it, such as copying the set photo
 * into a new member or propagating a changed photo to the other members.
 *
 * <p>The lock is taken before the transaction begins and released once it has completed. When the
 * caller already runs inside a transaction, the work joins it and the lock is held until that outer
 * transaction commits or rolls back.</p>
 */
@Component
public class InventoryWriteLock {

    private static final Logger logger = LoggerFactory.getLogger(InventoryWriteLock.class);

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;

    public InventoryWriteLock(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public <T> T call(Supplier<T> work) {
        if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
            logger.debug("Waiting for inventory write lock");
        }
        lock.lock();
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } finally {
                lock.unlock();
            }
        }
        try {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    lock.unlock();
                }
            });
        } catch (RuntimeException e) {
            lock.unlock();
            throw e;
        }
        return transactionTemplate.execute(status -> work.get());
    }

    public void run(Runnable work) {
        call(() -> {
            work.run();
            return null;
        });
    }

    boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}

package com.hydromat.tooling.service;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class InventoryWriteLockTest {

    @Autowired
    private InventoryWriteLock writeLock;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Test
    void call_runsWorkInTransactionAndReleasesAfterwards() {
        Boolean active = writeLock.call(TransactionSynchronizationManager::isActualTransactionActive);

        assertThat(active).isTrue();
        assertThat(writeLock.isHeldByCurrentThread()).isFalse();
    }

    @Test
    void call_insideOuterTransactionHoldsLockUntilItCompletes() {
        new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
            writeLock.run(() -> assertThat(writeLock.isHeldByCurrentThread()).isTrue());
            writeLock.run(() -> assertThat(writeLock.isHeldByCurrentThread()).isTrue());

            assertThat(writeLock.isHeldByCurrentThread()).isTrue();
            status.setRollbackOnly();
        });

        assertThat(writeLock.isHeldByCurrentThread()).isFalse();
    }

    @Test
    void call_releasesLockWhenWorkFails() {
        assertThatThrownBy(() -> writeLock.run(() -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(writeLock.isHeldByCurrentThread()).isFalse();
    }
}

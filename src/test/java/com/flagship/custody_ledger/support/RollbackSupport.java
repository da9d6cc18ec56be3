package com.flagship.custody_ledger.support;

import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.function.Supplier;

/**
 * Lets an in-memory fake take part in a Spring-managed transaction. The first
 * write inside a transaction captures the fake's state and a rollback restores
 * it. Outside a transaction every write is final.
 */
final class RollbackSupport {

    private RollbackSupport() {
    }

    static void beforeWrite(Object store, Supplier<Runnable> snapshot) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()
                || TransactionSynchronizationManager.hasResource(store)) {
            return;
        }
        Runnable restore = snapshot.get();
        TransactionSynchronizationManager.bindResource(store, restore);
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                TransactionSynchronizationManager.unbindResourceIfPossible(store);
                if (status == STATUS_ROLLED_BACK) {
                    restore.run();
                }
            }
        });
    }
}

package com.flagship.custody_ledger.support;

import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;
import org.springframework.transaction.support.SmartTransactionObject;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Transaction manager without a resource behind it. It runs Spring's full
 * propagation and rollback-only bookkeeping and records how each physical
 * transaction ended. In-memory fakes roll themselves back through
 * {@link RollbackSupport}.
 */
public class RecordingTransactionManager extends AbstractPlatformTransactionManager {

    public static final String COMMIT = "commit";
    public static final String ROLLBACK = "rollback";

    private final transient ThreadLocal<LocalTransaction> current = new ThreadLocal<>();
    private final List<String> outcomes = new CopyOnWriteArrayList<>();

    public List<String> outcomes() {
        return List.copyOf(outcomes);
    }

    public String lastOutcome() {
        return outcomes.isEmpty() ? null : outcomes.get(outcomes.size() - 1);
    }

    public void reset() {
        outcomes.clear();
    }

    @Override
    protected Object doGetTransaction() {
        LocalTransaction bound = current.get();
        return bound != null ? bound : new LocalTransaction();
    }

    @Override
    protected boolean isExistingTransaction(Object transaction) {
        return ((LocalTransaction) transaction).active;
    }

    @Override
    protected void doBegin(Object transaction, TransactionDefinition definition) {
        LocalTransaction tx = (LocalTransaction) transaction;
        tx.active = true;
        current.set(tx);
    }

    @Override
    protected void doCommit(DefaultTransactionStatus status) {
        outcomes.add(COMMIT);
    }

    @Override
    protected void doRollback(DefaultTransactionStatus status) {
        outcomes.add(ROLLBACK);
    }

    @Override
    protected void doSetRollbackOnly(DefaultTransactionStatus status) {
        ((LocalTransaction) status.getTransaction()).rollbackOnly = true;
    }

    @Override
    protected void doCleanupAfterCompletion(Object transaction) {
        ((LocalTransaction) transaction).active = false;
        current.remove();
    }

    private static final class LocalTransaction implements SmartTransactionObject {

        private boolean active;
        private boolean rollbackOnly;

        @Override
        public boolean isRollbackOnly() {
            return rollbackOnly;
        }

        @Override
        public void flush() {
        }
    }
}

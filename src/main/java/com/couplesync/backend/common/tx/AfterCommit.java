package com.couplesync.backend.common.tx;

import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

public final class AfterCommit {

    private AfterCommit() {}

    /**
     * 有 transaction：commit 後才跑（rollback 就不跑）
     * 沒 transaction：立即跑
     */
    public static void run(Runnable action) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override public void afterCommit() {
                    action.run();
                }
            });
        } else {
            action.run();
        }
    }
}

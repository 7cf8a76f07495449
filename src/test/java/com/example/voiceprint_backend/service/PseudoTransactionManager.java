package com.example.voiceprint_backend.service;

import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

/** Transaction manager for unit tests: every transaction is a no-op. */
class PseudoTransactionManager implements PlatformTransactionManager {

    @Override
    public TransactionStatus getTransaction(TransactionDefinition definition) throws TransactionException {
        return new SimpleTransactionStatus();
    }

    @Override
    public void commit(TransactionStatus status) throws TransactionException {
        // nothing to commit
    }

    @Override
    public void rollback(TransactionStatus status) throws TransactionException {
        // nothing to roll back
    }
}

package com.example.voiceprint_backend.service;

import com.example.voiceprint_backend.config.SpeakerMatchingProperties;
import com.example.voiceprint_backend.exception.ConcurrentModificationConflictException;
import jakarta.persistence.OptimisticLockException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a unit of work in its own transaction and re-runs it when it loses an optimistic
 * version check against a concurrent writer.
 */
@Component
public class ConflictRetrier {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConflictRetrier.class);

    private final TransactionTemplate txTemplate;
    private final int maxAttempts;

    public ConflictRetrier(TransactionTemplate txTemplate, SpeakerMatchingProperties props) {
        this.txTemplate = txTemplate;
        this.maxAttempts = Math.max(1, props.getConflictRetries());
    }

    public <T> T inTransaction(String operation, Supplier<T> work) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return txTemplate.execute(status -> work.get());
            } catch (RuntimeException e) {
                if (!isConflict(e)) {
                    throw e;
                }
                last = e;
                LOGGER.warn("CONFLICT op={} attempt={}/{} cause={}", operation, attempt, maxAttempts, e.toString());
            }
        }
        throw new ConcurrentModificationConflictException(operation, maxAttempts, last);
    }

    public void inTransaction(String operation, Runnable work) {
        inTransaction(operation, () -> {
            work.run();
            return null;
        });
    }

    static boolean isConflict(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ConcurrentModificationConflictException) {
                return false;
            }
            if (t instanceof ConcurrencyFailureException
                    || t instanceof OptimisticLockException
                    || t instanceof DataIntegrityViolationException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}

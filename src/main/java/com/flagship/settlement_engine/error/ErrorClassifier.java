package com.flagship.settlement_engine.error;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;

/**
 * Decides whether a failed event should be retried or dead-lettered.
 *
 * Retryable: lock timeouts, deadlocks, serialization failures, transaction
 * timeouts, lost connections and explicit {@link TransientEventException}s.
 * Everything else, including unexpected runtime errors, is treated as
 * non-retryable so that it is captured rather than looped on.
 */
@Component
public class ErrorClassifier {

    public boolean isRetryable(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof NonRetryableEventException) {
                return false;
            }
            if (current instanceof TransientEventException
                    || current instanceof TransientDataAccessException
                    || current instanceof RecoverableDataAccessException
                    || current instanceof DataAccessResourceFailureException
                    || current instanceof TransactionTimedOutException
                    || current instanceof CannotCreateTransactionException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Short, tag-safe name of the failure for the dead-letter log and metrics.
     */
    public String describe(Throwable error) {
        return error == null ? "unknown" : error.getClass().getSimpleName();
    }
}

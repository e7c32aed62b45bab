package com.cred.freestyle.warranty.exception;

/**
 * Exception thrown when a ledger operation keeps failing with transient storage
 * errors after all retry attempts.
 *
 * @author Warranty Platform Team
 */
public class LedgerUnavailableException extends RuntimeException {

    private final String operation;
    private final int attempts;

    public LedgerUnavailableException(String operation, int attempts, Throwable cause) {
        super(String.format("Ledger operation %s failed after %d attempt(s)", operation, attempts), cause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}

package com.nosota.scavenger.error;

/**
 * Thrown when a settlement needs more than the incentive program has left.
 */
public class InsufficientBudgetException extends ScavengerException {
    public InsufficientBudgetException() {
    }

    public InsufficientBudgetException(String message) {
        super(message);
    }

    public InsufficientBudgetException(String message, Throwable cause) {
        super(message, cause);
    }

    public InsufficientBudgetException(Throwable cause) {
        super(cause);
    }

    public InsufficientBudgetException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }

    @Override
    public String getCode() {
        return "INSUFFICIENT_BUDGET";
    }
}

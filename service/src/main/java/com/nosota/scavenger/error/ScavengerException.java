package com.nosota.scavenger.error;

/**
 * Base type of every business failure the engine reports.
 *
 * <p>Subclasses map one-to-one to the error codes exposed over REST
 * ({@link #getCode()}). Throwing one from a {@code @Transactional} service method
 * rolls the whole call back.
 */
public abstract class ScavengerException extends Exception {
    protected ScavengerException() {
    }

    protected ScavengerException(String message) {
        super(message);
    }

    protected ScavengerException(String message, Throwable cause) {
        super(message, cause);
    }

    protected ScavengerException(Throwable cause) {
        super(cause);
    }

    protected ScavengerException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }

    public abstract String getCode();
}

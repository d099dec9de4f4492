package com.nosota.scavenger.error;

/**
 * Thrown when reward, budget or earnings arithmetic leaves the range of {@code long}.
 */
public class RewardOverflowException extends ScavengerException {
    public RewardOverflowException() {
    }

    public RewardOverflowException(String message) {
        super(message);
    }

    public RewardOverflowException(String message, Throwable cause) {
        super(message, cause);
    }

    public RewardOverflowException(Throwable cause) {
        super(cause);
    }

    public RewardOverflowException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }

    @Override
    public String getCode() {
        return "OVERFLOW";
    }
}

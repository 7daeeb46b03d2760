package com.hiring.refnet.api;

/**
 * Unchecked carrier for a {@link ReferralError}, thrown by
 * {@link Result#orElseThrow()} and by the loading and ingestion layers.
 */
public class RefNetException extends RuntimeException {
    private final ReferralError error;

    public RefNetException(ReferralError error, String message) {
        super(message);
        this.error = error;
    }

    public RefNetException(ReferralError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public ReferralError error() {
        return error;
    }
}

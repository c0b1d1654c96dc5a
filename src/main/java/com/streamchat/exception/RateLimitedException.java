package com.streamchat.exception;

/**
 * Slow-mode violation. {@link #getRetryAfterSeconds()} is the whole number of seconds the
 * sender still has to wait, never zero while the request is being blocked.
 */
public class RateLimitedException extends ChatException {

    private final long retryAfterSeconds;

    public RateLimitedException(long retryAfterSeconds) {
        super(ChatErrorCode.RATE_LIMITED,
                "Slow mode is enabled. Please wait " + retryAfterSeconds + " seconds before sending another message.");
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}

package com.gymadmin.backend.global.error;

import java.util.Map;

public class RetryableProblemException extends ProblemException {

    private final long retryAfterSeconds;

    public RetryableProblemException(ErrorCode errorCode, String detail, long retryAfterSeconds, Map<String, ?> properties) {
        super(errorCode, detail, properties);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}

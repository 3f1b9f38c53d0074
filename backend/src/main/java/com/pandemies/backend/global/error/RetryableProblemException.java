package com.pandemies.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * A problem the caller may resolve by repeating the operation with fresh input.
 */
public class RetryableProblemException extends ProblemException {

    public RetryableProblemException(HttpStatus status, String code, String detail, Throwable cause) {
        super(status, code, detail, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

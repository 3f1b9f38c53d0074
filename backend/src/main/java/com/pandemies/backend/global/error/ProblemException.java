package com.pandemies.backend.global.error;

import java.util.Locale;

import org.springframework.http.HttpStatus;

/**
 * Recoverable failure carrying a stable machine code, in the spirit of RFC 7807 problem details.
 * The code is what callers branch on; the detail is for humans and logs.
 */
public class ProblemException extends RuntimeException {

    private static final String TYPE_PREFIX = "urn:problem:pandemies:";

    private final HttpStatus status;
    private final String code;
    private final String detail;
    private final String type;

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null);
    }

    public ProblemException(HttpStatus status, String code, String detail, Throwable cause) {
        super(code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.status = status != null ? status : HttpStatus.INTERNAL_SERVER_ERROR;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        this.type = TYPE_PREFIX + code.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\-_.:]+", "-");
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }

    public boolean isRetryable() {
        return false;
    }
}

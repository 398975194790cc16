package com.celflicks.backend.global.error;

import java.util.OptionalInt;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * 안정적인 problem code를 가진 오류. {@link RestExceptionHandler}가 problem 응답으로 변환한다.
 *
 * <p>재시도 가능한 오류는 {@code retryAfterSeconds}를 가지며, 응답의 Retry-After 헤더로 내려간다.
 */
public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detail;
    private final Integer retryAfterSeconds;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null);
    }

    protected ProblemException(HttpStatus status, String code, String detail, Integer retryAfterSeconds) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        if (retryAfterSeconds != null && retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public OptionalInt getRetryAfterSeconds() {
        return retryAfterSeconds == null ? OptionalInt.empty() : OptionalInt.of(retryAfterSeconds);
    }
}

package com.flagship.custody_ledger.error;

import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy shared by every custody operation.
 *
 * Each code maps to exactly one HTTP status so API clients can branch on
 * the code without parsing messages.
 */
public enum CustodyError {
    UNAUTHORIZED(HttpStatus.FORBIDDEN),
    ALREADY_EXISTS(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    INVALID_STATE(HttpStatus.CONFLICT),
    EXPIRED(HttpStatus.GONE),
    CAPACITY_EXCEEDED(HttpStatus.CONFLICT),
    TRANSFER_FAILED(HttpStatus.BAD_GATEWAY);

    private final HttpStatus httpStatus;

    CustodyError(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}

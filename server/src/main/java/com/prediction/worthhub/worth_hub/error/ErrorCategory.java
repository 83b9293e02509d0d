package com.prediction.worthhub.worth_hub.error;

import org.springframework.http.HttpStatus;

/**
 * Failure families. Each {@link ErrorCode} belongs to exactly one category,
 * which also decides the HTTP status the REST layer answers with.
 */
public enum ErrorCategory {

    /** Malformed or out-of-bounds instruction arguments. */
    VALIDATION(HttpStatus.BAD_REQUEST),

    /** Instruction arrived in the wrong lifecycle phase or outside its deadline window. */
    PHASE(HttpStatus.CONFLICT),

    /** Instruction contradicts recorded state (hash mismatch, unknown participants, overflow). */
    INTEGRITY(HttpStatus.CONFLICT),

    /** Signer is not allowed to issue the instruction. */
    AUTHORIZATION(HttpStatus.FORBIDDEN),

    /** Referenced ledger record does not exist. */
    NOT_FOUND(HttpStatus.NOT_FOUND);

    private final HttpStatus httpStatus;

    ErrorCategory(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}

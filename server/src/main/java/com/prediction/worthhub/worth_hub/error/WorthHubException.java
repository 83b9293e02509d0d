package com.prediction.worthhub.worth_hub.error;

/**
 * Thrown when an instruction is rejected. Rejection always happens before the
 * instruction's ledger write is applied, so no record is touched.
 */
public class WorthHubException extends RuntimeException {

    private final ErrorCode code;

    public WorthHubException(ErrorCode code) {
        super(code.getMessage());
        this.code = code;
    }

    public WorthHubException(ErrorCode code, String detail) {
        super(String.format("%s: %s", code.getMessage(), detail));
        this.code = code;
    }

    public WorthHubException(ErrorCode code, Throwable cause) {
        super(code.getMessage(), cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }
}

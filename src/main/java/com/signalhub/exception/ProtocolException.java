package com.signalhub.exception;

import com.signalhub.dto.ErrorResponse.ErrorCode;

/**
 * Thrown when an inbound frame cannot be decoded into a signaling envelope.
 * The offending message is dropped; the connection stays open.
 */
public class ProtocolException extends RuntimeException {

    private final ErrorCode errorCode;

    public ProtocolException(ErrorCode errorCode, String details) {
        super(errorCode.getMessage() + ": " + details);
        this.errorCode = errorCode;
    }

    public ProtocolException(ErrorCode errorCode, String details, Throwable cause) {
        super(errorCode.getMessage() + ": " + details, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getCode() {
        return errorCode.getCode();
    }
}

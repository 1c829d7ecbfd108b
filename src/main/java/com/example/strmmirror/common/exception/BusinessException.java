package com.example.strmmirror.common.exception;

/**
 * Rejected operator or scheduler request. {@code code} follows HTTP status semantics where one
 * fits ("404", "409") and is a symbolic name otherwise.
 */
public class BusinessException extends RuntimeException {

    private final String code;

    public BusinessException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

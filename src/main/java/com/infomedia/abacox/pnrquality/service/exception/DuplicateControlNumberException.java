package com.infomedia.abacox.pnrquality.service.exception;

public class DuplicateControlNumberException extends RuntimeException {

    public DuplicateControlNumberException(String message) {
        super(message);
    }

    public DuplicateControlNumberException(String message, Throwable cause) {
        super(message, cause);
    }
}

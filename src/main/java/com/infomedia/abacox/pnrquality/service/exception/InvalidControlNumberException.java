package com.infomedia.abacox.pnrquality.service.exception;

public class InvalidControlNumberException extends RuntimeException {

    public InvalidControlNumberException(String message) {
        super(message);
    }

    public InvalidControlNumberException(String message, Throwable cause) {
        super(message, cause);
    }
}

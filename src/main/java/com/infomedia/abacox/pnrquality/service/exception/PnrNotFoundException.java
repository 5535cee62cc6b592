package com.infomedia.abacox.pnrquality.service.exception;

public class PnrNotFoundException extends RuntimeException {

    public PnrNotFoundException(String message) {
        super(message);
    }

    public PnrNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}

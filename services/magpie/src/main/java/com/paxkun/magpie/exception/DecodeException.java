package com.paxkun.magpie.exception;

public class DecodeException extends ImageNormalizationException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.paxkun.magpie.exception;

/**
 * Base type for every failure Magpie raises on purpose.
 * <p>
 * Author: Pax
 */
public abstract class MagpieException extends RuntimeException {

    protected MagpieException(String message) {
        super(message);
    }

    protected MagpieException(String message, Throwable cause) {
        super(message, cause);
    }
}

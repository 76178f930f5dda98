package com.paxkun.magpie.exception;

/**
 * Aborts a whole run: the book could not be opened or the rendering session
 * could not be established. Runs are safe to repeat after this.
 */
public class FatalRunException extends MagpieException {

    public FatalRunException(String message) {
        super(message);
    }

    public FatalRunException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.paxkun.magpie.exception;

/**
 * The rendering engine did not reach the expected view in time.
 */
public class NavigationTimeoutException extends MagpieException {

    public NavigationTimeoutException(String message) {
        super(message);
    }

    public NavigationTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}

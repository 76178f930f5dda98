package com.paxkun.magpie.exception;

/**
 * A fetched payload could not be turned into a page image.
 */
public abstract class ImageNormalizationException extends MagpieException {

    protected ImageNormalizationException(String message) {
        super(message);
    }

    protected ImageNormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}

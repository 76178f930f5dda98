package com.paxkun.magpie.exception;

/**
 * Network or HTTP failure while fetching a page image, or a chapter whose
 * image set could not be completed.
 */
public class FetchException extends MagpieException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}

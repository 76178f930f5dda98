package com.paxkun.magpie.exception;

/**
 * Reading, writing or relocating an on-disk artifact failed.
 */
public class ArtifactIOException extends MagpieException {

    public ArtifactIOException(String message) {
        super(message);
    }

    public ArtifactIOException(String message, Throwable cause) {
        super(message, cause);
    }
}

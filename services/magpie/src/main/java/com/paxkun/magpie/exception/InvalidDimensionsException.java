package com.paxkun.magpie.exception;

public class InvalidDimensionsException extends ImageNormalizationException {

    public InvalidDimensionsException(int width, int height) {
        super("Invalid image dimensions (" + width + "x" + height + ")");
    }
}

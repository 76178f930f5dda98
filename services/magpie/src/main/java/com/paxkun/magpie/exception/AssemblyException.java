package com.paxkun.magpie.exception;

public class AssemblyException extends MagpieException {

    public AssemblyException(String message) {
        super(message);
    }

    public AssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.gridtrader.exception;

/** A stored record the caller asked for does not exist yet. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(ErrorCode errorCode, String what) {
        super(errorCode, "No " + what + " found");
    }
}

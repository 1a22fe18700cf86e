package com.rtbhouse.rangeset.api;

public class RangeSetException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RangeSetException(String message, Throwable cause) {
        super(message, cause);
    }

    public RangeSetException(String message) {
        super(message);
    }

    public RangeSetException(Throwable cause) {
        super(cause);
    }

}

package com.rtbhouse.rangeset.impl.errors;

import com.rtbhouse.rangeset.api.RangeSetException;

/**
 * Thrown when a range set operation is called with its preconditions not met.
 */
public class ContractViolationException extends RangeSetException {

    private static final long serialVersionUID = 1L;

    public ContractViolationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ContractViolationException(String message) {
        super(message);
    }

    public ContractViolationException(Throwable cause) {
        super(cause);
    }
}

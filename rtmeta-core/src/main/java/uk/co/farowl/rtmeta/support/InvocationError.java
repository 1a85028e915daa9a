// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.support;

/**
 * A member implementation (getter, setter, function body, constructor
 * or destructor) threw a checked exception. The API is unchecked
 * throughout, so the cause travels wrapped in this.
 */
public class InvocationError extends MetaError {
    private static final long serialVersionUID = 1L;

    /**
     * @param cause a Java exception thrown by the member
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public InvocationError(Throwable cause, String msg, Object... args) {
        super(cause, msg, args);
    }
}

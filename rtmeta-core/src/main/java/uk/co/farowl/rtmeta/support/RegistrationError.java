// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.support;

/**
 * The registry refused a declaration or removal, because it would leave
 * the published classes inconsistent.
 */
public class RegistrationError extends MetaError {
    private static final long serialVersionUID = 1L;

    /**
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public RegistrationError(String msg, Object... args) {
        super(msg, args);
    }

    /**
     * @param cause a Java exception behind the refusal
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public RegistrationError(Throwable cause, String msg,
            Object... args) {
        super(cause, msg, args);
    }
}

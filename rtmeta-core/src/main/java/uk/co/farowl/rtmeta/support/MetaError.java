// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.support;

/**
 * Base of the exceptions thrown when a caller breaks the contract of
 * the metadata API: an index out of range, an identifier that names no
 * member, a cast between unrelated classes, and so on. A
 * {@code MetaError} always propagates to the caller: nothing in the
 * run-time system recovers from one locally.
 * <p>
 * Each sub-class keeps the context of the failure in fields, so that a
 * caller may compose its own diagnostic without further state.
 */
public class MetaError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public MetaError(String msg, Object... args) {
        super(String.format(msg, args));
    }

    /**
     * Constructor specifying a cause and a message.
     *
     * @param cause a Java exception behind the error
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public MetaError(Throwable cause, String msg, Object... args) {
        super(String.format(msg, args), cause);
    }
}

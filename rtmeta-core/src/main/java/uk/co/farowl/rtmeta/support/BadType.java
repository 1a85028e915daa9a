// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.support;

/**
 * A value could not be converted to the type a member requires of it.
 */
public class BadType extends MetaError {
    private static final long serialVersionUID = 1L;

    private final String provided;
    private final Class<?> expected;

    /**
     * @param provided description of the value's type
     * @param expected type required
     */
    public BadType(String provided, Class<?> expected) {
        super("value of type %s cannot be converted to %s", provided,
                expected.getName());
        this.provided = provided;
        this.expected = expected;
    }

    /** @return description of the value's type */
    public String getProvided() { return provided; }

    /** @return type required */
    public Class<?> getExpected() { return expected; }
}

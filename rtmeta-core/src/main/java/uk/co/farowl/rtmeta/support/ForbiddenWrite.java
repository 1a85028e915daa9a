// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.support;

/** An attempt was made to assign a read-only property. */
public class ForbiddenWrite extends MetaError {
    private static final long serialVersionUID = 1L;

    private final String property;

    /** @param property name of the property */
    public ForbiddenWrite(String property) {
        super("the property '%s' is not writable", property);
        this.property = property;
    }

    /** @return name of the property */
    public String getProperty() { return property; }
}

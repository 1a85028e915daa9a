// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.support;

/** No class is registered under the name, id or Java class given. */
public class ClassNotFound extends MetaError {
    private static final long serialVersionUID = 1L;

    private final String name;

    /** @param name how the class was sought (name, id or Java class) */
    public ClassNotFound(String name) {
        super("the metaclass '%s' is not declared", name);
        this.name = name;
    }

    /** @return how the class was sought */
    public String getName() { return name; }
}

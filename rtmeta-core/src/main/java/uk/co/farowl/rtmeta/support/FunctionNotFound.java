// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.support;

import uk.co.farowl.rtmeta.core.StringId;

/**
 * Lookup of a function by identifier found nothing, through an API
 * that promises a result.
 */
public class FunctionNotFound extends MetaError {
    private static final long serialVersionUID = 1L;

    private final StringId id;
    private final String className;

    /**
     * @param id of the function sought
     * @param className name of the class searched
     */
    public FunctionNotFound(StringId id, String className) {
        super("the function '%s' was not found in class '%s'", id,
                className);
        this.id = id;
        this.className = className;
    }

    /** @return the identifier that was not found */
    public StringId getId() { return id; }

    /** @return name of the class searched */
    public String getClassName() { return className; }
}

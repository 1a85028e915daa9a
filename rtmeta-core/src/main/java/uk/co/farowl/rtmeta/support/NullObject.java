// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.support;

/**
 * A member that needs an instance was applied to the absent instance.
 */
public class NullObject extends MetaError {
    private static final long serialVersionUID = 1L;

    private final String member;

    /** @param member name of the member applied */
    public NullObject(String member) {
        super("trying to use %s on a null object", member);
        this.member = member;
    }

    /** @return name of the member applied */
    public String getMember() { return member; }
}

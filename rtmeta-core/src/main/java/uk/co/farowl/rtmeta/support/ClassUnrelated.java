// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.support;

/**
 * A cast was requested between two classes neither of which is a base
 * (directly or indirectly) of the other.
 */
public class ClassUnrelated extends MetaError {
    private static final long serialVersionUID = 1L;

    private final String sourceClass;
    private final String targetClass;

    /**
     * @param sourceClass name of the class cast from
     * @param targetClass name of the class cast to
     */
    public ClassUnrelated(String sourceClass, String targetClass) {
        super("failed to convert from %s to %s: they are not related",
                sourceClass, targetClass);
        this.sourceClass = sourceClass;
        this.targetClass = targetClass;
    }

    /** @return name of the class cast from */
    public String getSourceClass() { return sourceClass; }

    /** @return name of the class cast to */
    public String getTargetClass() { return targetClass; }
}

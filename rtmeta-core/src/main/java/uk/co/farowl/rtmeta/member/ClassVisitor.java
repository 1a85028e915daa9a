// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.member;

import uk.co.farowl.rtmeta.core.MetaClass;

/**
 * Receiver of the members of a class during
 * {@link MetaClass#visit(ClassVisitor)}. There is one callback per kind
 * of member. Each does nothing by default, so an implementation need
 * only override those of interest.
 */
public interface ClassVisitor {

    /** @param property a simple property */
    default void visit(SimpleProperty property) {}

    /** @param property an array property */
    default void visit(ArrayProperty property) {}

    /** @param property a property holding a registered type */
    default void visit(UserProperty property) {}

    /** @param function a function */
    default void visit(Function function) {}
}

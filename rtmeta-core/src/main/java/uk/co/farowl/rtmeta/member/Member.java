// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.member;

import uk.co.farowl.rtmeta.core.MetaClass;
import uk.co.farowl.rtmeta.core.StringId;

/**
 * A property or function registered on a {@link MetaClass}. The kinds
 * of member are closed: a {@link ClassVisitor} has one callback for
 * each, and {@link #accept(ClassVisitor)} picks the right one.
 * <p>
 * The {@code MetaClass} owns its members and releases them when it is
 * itself released. A released member refuses further use.
 */
public sealed interface Member permits Property, Function {

    /** @return the identifier by which the member is looked up */
    StringId getId();

    /** @return the name of the member */
    String getName();

    /**
     * Present this member to the visitor through the callback proper
     * to its kind.
     *
     * @param visitor to call back
     */
    void accept(ClassVisitor visitor);

    /**
     * Release the member. Called exactly once, by the owning class.
     */
    void release();

    /** @return whether {@link #release()} has been called */
    boolean isReleased();
}

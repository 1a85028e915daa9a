// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.member;

import uk.co.farowl.rtmeta.core.Args;
import uk.co.farowl.rtmeta.core.MetaClass;

/**
 * A way to create instances of a class, registered on its
 * {@link MetaClass}. {@link MetaClass#construct(Args)} asks each
 * constructor in turn whether it {@link #matches(Args)} and uses the
 * first that does.
 */
public interface Constructor {

    /**
     * Decide whether this constructor accepts the given arguments: the
     * count is right and each argument converts to the type expected in
     * its position.
     *
     * @param args proposed
     * @return whether {@link #create(Args)} would accept them
     */
    boolean matches(Args args);

    /**
     * Create an instance. The caller has established that
     * {@link #matches(Args)} is {@code true}.
     *
     * @param args to the constructor
     * @return the new instance
     */
    Object create(Args args);

    /**
     * Release resources held by the constructor. Called exactly once,
     * by the owning class. The default does nothing.
     */
    default void release() {}
}

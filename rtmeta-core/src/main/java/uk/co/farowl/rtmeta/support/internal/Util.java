// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.support.internal;

import java.util.function.Consumer;

import uk.co.farowl.rtmeta.support.InvocationError;

/**
 * Convenient constants etc. for use across the implementation and not
 * needing a registry to be working.
 */
public class Util {

    private Util() {} // no instances

    /** An empty array of objects. */
    public static final Object[] EMPTY_ARRAY = new Object[0];

    /**
     * Convert any {@code Throwable} except an {@code Error} to a
     * {@code RuntimeException}, so that (if not already) it becomes an
     * unchecked exception. An {@code Error} is re-thrown directly. We
     * use this where a call is made to
     * {@code MethodHandle.invokeWithArguments}, which is declared to
     * throw {@code Throwable}, around a member implementation supplied
     * at registration.
     *
     * @param t to propagate or encapsulate
     * @param during format string for detail message, typically like
     *     "during call to %s" where {@code args} contains the member.
     * @param args to insert into format string.
     * @return run-time exception to throw
     */
    public static RuntimeException asUnchecked(Throwable t,
            String during, Object... args) {
        if (t instanceof RuntimeException)
            return (RuntimeException)t;
        else if (t instanceof Error)
            throw (Error)t;
        else
            return new InvocationError(t, during, args);
    }

    /**
     * Apply an action to every item, even if it throws for some of
     * them, then re-throw the first {@code RuntimeException} (or
     * {@code Error}) raised, with any later ones attached to it as
     * suppressed exceptions.
     *
     * @param <T> type of item
     * @param items to act on in iteration order
     * @param action to apply to each item
     */
    public static <T> void applyToAll(Iterable<? extends T> items,
            Consumer<? super T> action) {
        Throwable first = null;
        for (T item : items) {
            try {
                action.accept(item);
            } catch (RuntimeException | Error e) {
                if (first == null)
                    first = e;
                else
                    first.addSuppressed(e);
            }
        }
        if (first instanceof RuntimeException)
            throw (RuntimeException)first;
        else if (first != null)
            throw (Error)first;
    }
}

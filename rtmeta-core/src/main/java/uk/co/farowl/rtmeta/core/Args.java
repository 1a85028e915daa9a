// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.core;

import java.util.StringJoiner;

import uk.co.farowl.rtmeta.support.OutOfRange;
import uk.co.farowl.rtmeta.support.internal.Util;

/**
 * An immutable list of positional arguments, passed to constructors and
 * functions across the reflection boundary.
 */
public final class Args {

    /** The empty argument list. */
    public static final Args EMPTY = new Args(Util.EMPTY_ARRAY);

    private final Object[] values;

    private Args(Object[] values) { this.values = values; }

    /**
     * Create an argument list. The array is copied.
     *
     * @param values of the arguments (elements may be {@code null})
     * @return argument list
     */
    public static Args of(Object... values) {
        return values.length == 0 ? EMPTY : new Args(values.clone());
    }

    /** @return number of arguments */
    public int count() { return values.length; }

    /**
     * Return the argument at the given position.
     *
     * @param index of the argument
     * @return the argument
     * @throws OutOfRange if {@code index >= count()} or negative
     */
    public Object get(int index) throws OutOfRange {
        if (index < 0 || index >= values.length)
            throw new OutOfRange(index, values.length);
        return values[index];
    }

    /** @return a copy of the arguments as an array */
    public Object[] toArray() { return values.clone(); }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "(", ")");
        for (Object v : values) { sj.add(String.valueOf(v)); }
        return sj.toString();
    }
}

// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.support;

/**
 * A positional accessor was given an index outside the collection it
 * indexes.
 */
public class OutOfRange extends MetaError {
    private static final long serialVersionUID = 1L;

    private final int index;
    private final int size;

    /**
     * @param index the offending index
     * @param size of the collection indexed
     */
    public OutOfRange(int index, int size) {
        super("the index (%d) is out of the allowed range [0, %d]",
                index, size - 1);
        this.index = index;
        this.size = size;
    }

    /** @return the offending index */
    public int getIndex() { return index; }

    /** @return the size of the collection indexed */
    public int getSize() { return size; }
}

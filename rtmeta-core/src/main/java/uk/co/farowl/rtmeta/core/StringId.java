// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.core;

/**
 * Stable identifier of a member, derived from its name by a 32-bit
 * FNV-1a hash. Member tables are sorted by {@code StringId} so that a
 * lookup is a binary search comparing integers, not strings.
 * <p>
 * Two identifiers are equal if their hashes are equal. The registry
 * refuses to publish a class in which two member names collide.
 */
public final class StringId implements Comparable<StringId> {

    private static final int FNV_OFFSET_BASIS = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    private final int hash;
    private final String text;

    private StringId(int hash, String text) {
        this.hash = hash;
        this.text = text;
    }

    /**
     * Return the identifier of a given name.
     *
     * @param name of a member
     * @return its identifier
     */
    public static StringId of(String name) {
        int h = FNV_OFFSET_BASIS;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            // Hash both bytes of the UTF-16 unit, low byte first.
            h = (h ^ (c & 0xff)) * FNV_PRIME;
            h = (h ^ (c >>> 8)) * FNV_PRIME;
        }
        return new StringId(h, name);
    }

    /** @return the hash value that orders and identifies this */
    public int value() { return hash; }

    /** @return the name from which this was computed */
    public String text() { return text; }

    @Override
    public int compareTo(StringId other) {
        return Integer.compareUnsigned(hash, other.hash);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof StringId && ((StringId)obj).hash == hash;
    }

    @Override
    public int hashCode() { return hash; }

    @Override
    public String toString() { return text; }
}

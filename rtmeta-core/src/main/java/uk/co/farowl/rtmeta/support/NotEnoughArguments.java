// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.support;

/** A function was called with fewer arguments than it declares. */
public class NotEnoughArguments extends MetaError {
    private static final long serialVersionUID = 1L;

    private final String member;
    private final int provided;
    private final int expected;

    /**
     * @param member name of the function called
     * @param provided number of arguments supplied
     * @param expected number of parameters declared
     */
    public NotEnoughArguments(String member, int provided,
            int expected) {
        super("not enough arguments for calling %s: %d provided, %d expected",
                member, provided, expected);
        this.member = member;
        this.provided = provided;
        this.expected = expected;
    }

    /** @return name of the function called */
    public String getMember() { return member; }

    /** @return number of arguments supplied */
    public int getProvided() { return provided; }

    /** @return number of parameters declared */
    public int getExpected() { return expected; }
}

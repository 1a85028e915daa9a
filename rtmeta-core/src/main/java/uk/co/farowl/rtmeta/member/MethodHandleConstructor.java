// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.member;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.MethodType;

import uk.co.farowl.rtmeta.core.Args;
import uk.co.farowl.rtmeta.support.RegistrationError;
import uk.co.farowl.rtmeta.support.internal.Util;

/**
 * A {@link Constructor} implemented by a method handle, typically to a
 * Java constructor. It matches an argument list of exactly its arity in
 * which each argument converts to the parameter type.
 */
public final class MethodHandleConstructor implements Constructor {

    private final MethodHandle handle;

    private MethodHandleConstructor(MethodHandle handle) {
        this.handle = handle;
    }

    /**
     * Create a constructor from a handle returning the new instance.
     *
     * @param handle of type {@code (P1, ... Pn)T}
     * @return the constructor
     */
    public static MethodHandleConstructor of(MethodHandle handle) {
        return new MethodHandleConstructor(handle);
    }

    /**
     * Create a constructor from a Java constructor of the given class.
     *
     * @param lookup with access to the constructor
     * @param c class to construct
     * @param parameterTypes of the Java constructor
     * @return the constructor
     * @throws RegistrationError if the constructor cannot be found or
     *     accessed
     */
    public static MethodHandleConstructor forConstructor(Lookup lookup,
            Class<?> c, Class<?>... parameterTypes)
            throws RegistrationError {
        try {
            MethodType mt = MethodType.methodType(void.class,
                    parameterTypes);
            return new MethodHandleConstructor(
                    lookup.findConstructor(c, mt));
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new RegistrationError(e,
                    "cannot expose constructor of %s", c.getName());
        }
    }

    /** @return number of arguments the constructor expects */
    public int arity() { return handle.type().parameterCount(); }

    @Override
    public boolean matches(Args args) {
        MethodType type = handle.type();
        int n = type.parameterCount();
        if (args.count() != n) { return false; }
        for (int i = 0; i < n; i++) {
            if (!Conversions.canConvert(args.get(i),
                    type.parameterType(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Object create(Args args) {
        MethodType type = handle.type();
        int n = type.parameterCount();
        Object[] a = new Object[n];
        for (int i = 0; i < n; i++) {
            a[i] = Conversions.convert(args.get(i), type.parameterType(i));
        }
        try {
            return handle.invokeWithArguments(a);
        } catch (Throwable t) {
            throw Util.asUnchecked(t, "during construction by %s",
                    handle);
        }
    }

    @Override
    public String toString() {
        return String.format("<constructor %s>", handle.type());
    }
}

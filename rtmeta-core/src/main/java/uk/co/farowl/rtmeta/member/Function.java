// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.member;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;

import uk.co.farowl.rtmeta.core.Args;
import uk.co.farowl.rtmeta.core.StringId;
import uk.co.farowl.rtmeta.core.UserObject;
import uk.co.farowl.rtmeta.support.NotEnoughArguments;
import uk.co.farowl.rtmeta.support.NullObject;
import uk.co.farowl.rtmeta.support.OutOfRange;
import uk.co.farowl.rtmeta.support.RegistrationError;
import uk.co.farowl.rtmeta.support.internal.Util;

/**
 * A function of a registered class, implemented by a method handle
 * whose first parameter is the receiving instance. The arity of the
 * function is the number of parameters after the receiver.
 */
public final class Function implements Member {

    private final StringId id;
    private final String name;
    private final boolean isStatic;

    /** Receiver first, then {@link #arity} parameters. */
    private final MethodHandle handle;
    private final int arity;

    private volatile boolean released;

    private Function(String name, MethodHandle handle,
            boolean isStatic) {
        this.id = StringId.of(name);
        this.name = name;
        this.handle = handle;
        this.isStatic = isStatic;
        this.arity = handle.type().parameterCount() - 1;
    }

    /**
     * Create a function from a handle taking the receiver first.
     *
     * @param name of the function
     * @param handle of type {@code (R, P1, ... Pn)T}
     * @return the function
     * @throws RegistrationError if the handle has no receiver parameter
     */
    public static Function of(String name, MethodHandle handle)
            throws RegistrationError {
        if (handle.type().parameterCount() < 1) {
            throw new RegistrationError(
                    "function %s has no receiver parameter", name);
        }
        return new Function(name, handle, false);
    }

    /**
     * Create a function that needs no instance, from a handle taking
     * only the arguments. It may be called with any receiver, including
     * {@link UserObject#NOTHING}.
     *
     * @param name of the function
     * @param handle of type {@code (P1, ... Pn)T}
     * @return the function
     */
    public static Function ofStatic(String name, MethodHandle handle) {
        MethodHandle h =
                MethodHandles.dropArguments(handle, 0, Object.class);
        return new Function(name, h, true);
    }

    /**
     * Create a function from a Java method, static or not, named as the
     * method is.
     *
     * @param lookup with access to the method
     * @param method to expose
     * @return the function
     * @throws RegistrationError if the method cannot be accessed
     */
    public static Function forMethod(Lookup lookup, Method method)
            throws RegistrationError {
        try {
            MethodHandle mh = lookup.unreflect(method);
            if (Modifier.isStatic(method.getModifiers())) {
                return ofStatic(method.getName(), mh);
            } else {
                return new Function(method.getName(), mh, false);
            }
        } catch (IllegalAccessException e) {
            throw new RegistrationError(e, "cannot expose method %s",
                    method);
        }
    }

    @Override
    public StringId getId() { return id; }

    @Override
    public String getName() { return name; }

    /** @return number of arguments the function expects */
    public int arity() { return arity; }

    /** @return whether the function needs no instance */
    public boolean isStatic() { return isStatic; }

    /** @return the Java return type of the function */
    public Class<?> getReturnType() { return handle.type().returnType(); }

    /**
     * Return the Java type of one parameter (not counting the receiver).
     *
     * @param index of the parameter
     * @return its type
     * @throws OutOfRange if {@code index >= arity()}
     */
    public Class<?> getParameterType(int index) throws OutOfRange {
        if (index < 0 || index >= arity) {
            throw new OutOfRange(index, arity);
        }
        return handle.type().parameterType(index + 1);
    }

    /**
     * Call the function on an instance. Arguments are converted to the
     * parameter types. Arguments beyond the arity are ignored.
     *
     * @param object receiving the call
     * @param args to the function
     * @return the result ({@code null} if the function is void)
     * @throws NotEnoughArguments if there are too few arguments
     * @throws NullObject if an instance is needed and {@code object} is
     *     absent
     */
    public Object call(UserObject object, Args args)
            throws NotEnoughArguments, NullObject {
        if (released) {
            throw new IllegalStateException(
                    String.format("function %s has been released", name));
        }
        if (args.count() < arity) {
            throw new NotEnoughArguments(name, args.count(), arity);
        }
        Object[] a = new Object[arity + 1];
        if (isStatic) {
            a[0] = null;
        } else if (object == null || object.isNothing()) {
            throw new NullObject(name);
        } else {
            a[0] = object.get();
        }
        MethodType type = handle.type();
        for (int i = 0; i < arity; i++) {
            a[i + 1] = Conversions.convert(args.get(i),
                    type.parameterType(i + 1));
        }
        try {
            return handle.invokeWithArguments(a);
        } catch (Throwable t) {
            throw Util.asUnchecked(t, "during call to %s", name);
        }
    }

    @Override
    public void accept(ClassVisitor visitor) { visitor.visit(this); }

    @Override
    public void release() { released = true; }

    @Override
    public boolean isReleased() { return released; }

    @Override
    public String toString() {
        return String.format("<function %s/%d>", name, arity);
    }
}

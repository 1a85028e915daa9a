// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.member;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodType;

import uk.co.farowl.rtmeta.core.StringId;
import uk.co.farowl.rtmeta.core.UserObject;
import uk.co.farowl.rtmeta.support.ForbiddenWrite;
import uk.co.farowl.rtmeta.support.NullObject;
import uk.co.farowl.rtmeta.support.internal.Util;

/**
 * A property of a registered class, read (and possibly written)
 * through method handles bound at registration.
 */
public abstract sealed class Property implements Member
        permits SimpleProperty, ArrayProperty, UserProperty {

    /** Type of {@link #getter} after adaptation. */
    private static final MethodType GETTER =
            MethodType.methodType(Object.class, Object.class);
    /** Type of {@link #setter} after adaptation. */
    private static final MethodType SETTER =
            MethodType.methodType(void.class, Object.class, Object.class);

    private final StringId id;
    private final String name;
    private final Class<?> type;

    /** Handle of type {@code (Object)Object}. */
    private final MethodHandle getter;
    /** Handle of type {@code (Object,Object)void} or {@code null}. */
    private final MethodHandle setter;

    private volatile boolean released;

    /**
     * Create a property. The handles may have any receiver type and
     * value type: they are adapted here to {@code Object}.
     *
     * @param name of the property
     * @param type of the property value
     * @param getter of type {@code (R)T}
     * @param setter of type {@code (R,T)void} or {@code null} if the
     *     property is read-only
     */
    Property(String name, Class<?> type, MethodHandle getter,
            MethodHandle setter) {
        this.id = StringId.of(name);
        this.name = name;
        this.type = type;
        this.getter = getter.asType(GETTER);
        this.setter = setter == null ? null : setter.asType(SETTER);
    }

    @Override
    public StringId getId() { return id; }

    @Override
    public String getName() { return name; }

    /** @return the type of the property value */
    public Class<?> getType() { return type; }

    /** @return whether {@link #set(UserObject, Object)} is allowed */
    public boolean isWritable() { return setter != null; }

    /**
     * Read the property of an instance.
     *
     * @param object to read
     * @return the value of the property
     * @throws NullObject if {@code object} is absent
     */
    public Object get(UserObject object) throws NullObject {
        return wrap(getRaw(object));
    }

    /**
     * Write the property of an instance.
     *
     * @param object to write
     * @param value to assign (converted to the property type)
     * @throws ForbiddenWrite if the property is read-only
     * @throws NullObject if {@code object} is absent
     */
    public void set(UserObject object, Object value)
            throws ForbiddenWrite, NullObject {
        Object target = receiver(object);
        if (setter == null) { throw new ForbiddenWrite(name); }
        Object v = unwrap(value);
        try {
            setter.invokeExact(target, v);
        } catch (Throwable t) {
            throw Util.asUnchecked(t, "during set of %s", name);
        }
    }

    /**
     * Read the property of an instance without conversion of the
     * result by {@link #wrap(Object)}.
     *
     * @param object to read
     * @return the value from the getter
     */
    final Object getRaw(UserObject object) {
        Object target = receiver(object);
        try {
            return (Object)getter.invokeExact(target);
        } catch (Throwable t) {
            throw Util.asUnchecked(t, "during get of %s", name);
        }
    }

    /**
     * Convert a value from the getter to the form presented to the
     * caller. The default is no conversion.
     *
     * @param value from the getter
     * @return value for the caller
     */
    Object wrap(Object value) { return value; }

    /**
     * Convert a value from the caller to the form the setter expects.
     * The default applies the {@link Conversions} to the property type.
     *
     * @param value from the caller
     * @return value for the setter
     */
    Object unwrap(Object value) { return Conversions.convert(value, type); }

    /**
     * Check the property is still usable and return the instance in a
     * {@code UserObject}.
     *
     * @param object holding the instance
     * @return the instance
     */
    final Object receiver(UserObject object) {
        if (released) {
            throw new IllegalStateException(
                    String.format("property %s has been released", name));
        }
        if (object == null || object.isNothing()) {
            throw new NullObject(name);
        }
        return object.get();
    }

    @Override
    public void release() { released = true; }

    @Override
    public boolean isReleased() { return released; }

    @Override
    public String toString() {
        return String.format("<%s %s: %s>", getClass().getSimpleName(),
                name, type.getSimpleName());
    }
}

// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.member;

import java.lang.invoke.MethodHandle;

import uk.co.farowl.rtmeta.core.MetaClass;
import uk.co.farowl.rtmeta.core.UserObject;

/**
 * A property whose value is an instance of a registered class. The
 * value is presented to the caller as a {@link UserObject} typed as
 * {@link #getValueClass()} (or {@link UserObject#NOTHING} for
 * {@code null}), and a {@code UserObject} or the bare instance is
 * accepted on assignment.
 */
public final class UserProperty extends Property {

    private final MetaClass valueClass;

    private UserProperty(String name, MetaClass valueClass,
            MethodHandle getter, MethodHandle setter) {
        super(name, getter.type().returnType(), getter, setter);
        this.valueClass = valueClass;
    }

    /**
     * Create a property from a getter and optional setter.
     *
     * @param name of the property
     * @param valueClass registered class of the value
     * @param getter of type {@code (R)T}
     * @param setter of type {@code (R,T)void} or {@code null}
     * @return the property
     */
    public static UserProperty of(String name, MetaClass valueClass,
            MethodHandle getter, MethodHandle setter) {
        return new UserProperty(name, valueClass, getter, setter);
    }

    /** @return the registered class of the value */
    public MetaClass getValueClass() { return valueClass; }

    @Override
    Object wrap(Object value) {
        return value == null ? UserObject.NOTHING
                : new UserObject(value, valueClass);
    }

    @Override
    Object unwrap(Object value) {
        if (value instanceof UserObject) {
            value = ((UserObject)value).get();
        }
        return super.unwrap(value);
    }

    @Override
    public void accept(ClassVisitor visitor) { visitor.visit(this); }
}

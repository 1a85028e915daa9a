// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.member;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;

import uk.co.farowl.rtmeta.support.RegistrationError;

/** A property holding a single value of a Java type. */
public final class SimpleProperty extends Property {

    private SimpleProperty(String name, Class<?> type,
            MethodHandle getter, MethodHandle setter) {
        super(name, type, getter, setter);
    }

    /**
     * Create a property from a getter and optional setter. The type of
     * the property is the return type of the getter.
     *
     * @param name of the property
     * @param getter of type {@code (R)T}
     * @param setter of type {@code (R,T)void} or {@code null}
     * @return the property
     */
    public static SimpleProperty of(String name, MethodHandle getter,
            MethodHandle setter) {
        return new SimpleProperty(name, getter.type().returnType(),
                getter, setter);
    }

    /**
     * Create a property that reads and writes a field of a Java class.
     * The property is read-only if the field is {@code final}. Static
     * fields are not properties.
     *
     * @param lookup with access to the field
     * @param owner class declaring the field
     * @param fieldName name of the field (and of the property)
     * @return the property
     * @throws RegistrationError if the field cannot be found or accessed
     */
    public static SimpleProperty forField(Lookup lookup, Class<?> owner,
            String fieldName) throws RegistrationError {
        try {
            Field f = owner.getDeclaredField(fieldName);
            if (Modifier.isStatic(f.getModifiers())) {
                throw new RegistrationError("field %s.%s is static",
                        owner.getName(), fieldName);
            }
            MethodHandle getter = lookup.unreflectGetter(f);
            MethodHandle setter = Modifier.isFinal(f.getModifiers())
                    ? null : lookup.unreflectSetter(f);
            return new SimpleProperty(fieldName, f.getType(), getter,
                    setter);
        } catch (NoSuchFieldException | IllegalAccessException e) {
            throw new RegistrationError(e, "cannot expose field %s.%s",
                    owner.getName(), fieldName);
        }
    }

    @Override
    public void accept(ClassVisitor visitor) { visitor.visit(this); }
}

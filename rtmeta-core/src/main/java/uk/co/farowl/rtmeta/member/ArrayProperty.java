// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.member;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.List;

import uk.co.farowl.rtmeta.core.UserObject;
import uk.co.farowl.rtmeta.support.ForbiddenWrite;
import uk.co.farowl.rtmeta.support.OutOfRange;
import uk.co.farowl.rtmeta.support.RegistrationError;

/**
 * A property whose value is a sequence: a Java array or a
 * {@code List}. Besides reading and writing the whole value, the
 * elements may be read and written by index.
 */
public final class ArrayProperty extends Property {

    private final Class<?> elementType;

    private ArrayProperty(String name, Class<?> type,
            Class<?> elementType, MethodHandle getter,
            MethodHandle setter) {
        super(name, type, getter, setter);
        this.elementType = elementType;
    }

    /**
     * Create a property from a getter and optional setter. The getter
     * must return an array or a {@code List}.
     *
     * @param name of the property
     * @param elementType type of the elements
     * @param getter of type {@code (R)T}
     * @param setter of type {@code (R,T)void} or {@code null}
     * @return the property
     * @throws RegistrationError if the getter does not return a
     *     sequence
     */
    public static ArrayProperty of(String name, Class<?> elementType,
            MethodHandle getter, MethodHandle setter)
            throws RegistrationError {
        Class<?> type = getter.type().returnType();
        checkSequence(name, type);
        return new ArrayProperty(name, type, elementType, getter, setter);
    }

    /**
     * Create a property that reads and writes an array or
     * {@code List} field of a Java class. The element type is the
     * component type of an array, and {@code Object} for a
     * {@code List}.
     *
     * @param lookup with access to the field
     * @param owner class declaring the field
     * @param fieldName name of the field (and of the property)
     * @return the property
     * @throws RegistrationError if the field cannot be found or accessed
     *     or is not a sequence
     */
    public static ArrayProperty forField(Lookup lookup, Class<?> owner,
            String fieldName) throws RegistrationError {
        try {
            Field f = owner.getDeclaredField(fieldName);
            Class<?> type = f.getType();
            checkSequence(fieldName, type);
            Class<?> elementType = type.isArray()
                    ? type.getComponentType() : Object.class;
            MethodHandle setter = Modifier.isFinal(f.getModifiers())
                    ? null : lookup.unreflectSetter(f);
            return new ArrayProperty(fieldName, type, elementType,
                    lookup.unreflectGetter(f), setter);
        } catch (NoSuchFieldException | IllegalAccessException e) {
            throw new RegistrationError(e, "cannot expose field %s.%s",
                    owner.getName(), fieldName);
        }
    }

    private static void checkSequence(String name, Class<?> type) {
        if (!type.isArray() && !List.class.isAssignableFrom(type)) {
            throw new RegistrationError(
                    "array property %s has non-sequence type %s", name,
                    type.getName());
        }
    }

    /** @return the type of the elements */
    public Class<?> getElementType() { return elementType; }

    /**
     * Return the number of elements in the value of the property.
     *
     * @param object to read
     * @return the number of elements (0 if the value is {@code null})
     */
    public int size(UserObject object) {
        Object seq = getRaw(object);
        if (seq == null) {
            return 0;
        } else if (seq instanceof List) {
            return ((List<?>)seq).size();
        } else {
            return Array.getLength(seq);
        }
    }

    /**
     * Read one element of the value of the property.
     *
     * @param object to read
     * @param index of the element
     * @return the element
     * @throws OutOfRange if the index is not that of an element
     */
    public Object getElement(UserObject object, int index)
            throws OutOfRange {
        Object seq = getRaw(object);
        checkIndex(seq, index);
        if (seq instanceof List) {
            return ((List<?>)seq).get(index);
        } else {
            return Array.get(seq, index);
        }
    }

    /**
     * Write one element of the value of the property.
     *
     * @param object to write
     * @param index of the element
     * @param value to assign (converted to the element type)
     * @throws OutOfRange if the index is not that of an element
     * @throws ForbiddenWrite if the sequence is not modifiable
     */
    public void setElement(UserObject object, int index, Object value)
            throws OutOfRange, ForbiddenWrite {
        Object seq = getRaw(object);
        checkIndex(seq, index);
        Object v = Conversions.convert(value, elementType);
        if (seq instanceof List) {
            @SuppressWarnings("unchecked")
            List<Object> list = (List<Object>)seq;
            try {
                list.set(index, v);
            } catch (UnsupportedOperationException e) {
                throw new ForbiddenWrite(getName());
            }
        } else {
            Array.set(seq, index, v);
        }
    }

    private void checkIndex(Object seq, int index) throws OutOfRange {
        int n = seq == null ? 0
                : seq instanceof List ? ((List<?>)seq).size()
                        : Array.getLength(seq);
        if (index < 0 || index >= n) { throw new OutOfRange(index, n); }
    }

    @Override
    public void accept(ClassVisitor visitor) { visitor.visit(this); }
}

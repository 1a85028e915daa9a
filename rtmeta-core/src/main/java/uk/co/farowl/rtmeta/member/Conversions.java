// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.member;

import java.util.Map;

import uk.co.farowl.rtmeta.support.BadType;

/**
 * The conversions applied to a value passed to a member: boxing, and
 * conversion between the numeric types. {@code null} converts to any
 * reference type.
 */
public final class Conversions {

    private Conversions() {} // no instances

    private static final Map<Class<?>, Class<?>> BOXED = Map.of( //
            boolean.class, Boolean.class, //
            byte.class, Byte.class, //
            char.class, Character.class, //
            short.class, Short.class, //
            int.class, Integer.class, //
            long.class, Long.class, //
            float.class, Float.class, //
            double.class, Double.class, //
            void.class, Void.class);

    /**
     * Return the wrapper class of a primitive, or the argument itself
     * if it is not primitive.
     *
     * @param type to box
     * @return the boxed type
     */
    public static Class<?> boxed(Class<?> type) {
        return type.isPrimitive() ? BOXED.get(type) : type;
    }

    /**
     * Decide whether {@link #convert(Object, Class)} would succeed.
     *
     * @param value to convert
     * @param type required
     * @return whether the value converts
     */
    public static boolean canConvert(Object value, Class<?> type) {
        if (value == null) { return !type.isPrimitive(); }
        Class<?> b = boxed(type);
        return b.isInstance(value)
                || (value instanceof Number && isNumeric(b));
    }

    /**
     * Convert a value to the type required, or its wrapper if primitive.
     *
     * @param value to convert
     * @param type required
     * @return the converted value
     * @throws BadType if the value does not convert
     */
    public static Object convert(Object value, Class<?> type)
            throws BadType {
        if (value == null) {
            if (type.isPrimitive()) {
                throw new BadType("null", type);
            }
            return null;
        }
        Class<?> b = boxed(type);
        if (b.isInstance(value)) {
            return value;
        } else if (value instanceof Number && isNumeric(b)) {
            Number n = (Number)value;
            if (b == Integer.class) {
                return n.intValue();
            } else if (b == Long.class) {
                return n.longValue();
            } else if (b == Double.class) {
                return n.doubleValue();
            } else if (b == Float.class) {
                return n.floatValue();
            } else if (b == Short.class) {
                return n.shortValue();
            } else {
                return n.byteValue();
            }
        }
        throw new BadType(value.getClass().getName(), type);
    }

    private static boolean isNumeric(Class<?> boxed) {
        return boxed == Integer.class || boxed == Long.class
                || boxed == Double.class || boxed == Float.class
                || boxed == Short.class || boxed == Byte.class;
    }
}

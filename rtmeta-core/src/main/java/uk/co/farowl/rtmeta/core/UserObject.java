// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.core;

import java.util.Objects;

/**
 * An opaque instance crossing the reflection boundary: a Java object,
 * the {@link MetaClass} as which it is currently viewed, and the byte
 * offset of that view within the layout of the instance.
 * <p>
 * Construction produces the most derived view, at offset zero. Casting
 * with {@link #as(MetaClass)} produces another view of the same
 * instance, with the offset adjusted along the inheritance graph.
 * {@link #NOTHING} is the absent instance and plays the part of a null
 * pointer.
 */
public final class UserObject {

    /** The absent instance. */
    public static final UserObject NOTHING = new UserObject();

    private final Object instance;
    private final MetaClass metaClass;
    private final int offset;

    private UserObject() {
        this.instance = null;
        this.metaClass = null;
        this.offset = 0;
    }

    private UserObject(Object instance, MetaClass metaClass,
            int offset) {
        this.instance = Objects.requireNonNull(instance, "instance");
        this.metaClass = Objects.requireNonNull(metaClass, "metaClass");
        this.offset = offset;
    }

    /**
     * Create the most derived view of an instance.
     *
     * @param instance the Java object
     * @param metaClass its class
     */
    public UserObject(Object instance, MetaClass metaClass) {
        this(instance, metaClass, 0);
    }

    /**
     * Another view of the same instance.
     *
     * @param target class of the new view
     * @param delta to add to the offset
     * @return the new view
     */
    UserObject moved(MetaClass target, int delta) {
        return new UserObject(instance, target, offset + delta);
    }

    /** @return whether this is {@link #NOTHING} */
    public boolean isNothing() { return instance == null; }

    /** @return the instance, {@code null} for {@link #NOTHING} */
    public Object get() { return instance; }

    /**
     * Return the instance as a given Java type.
     *
     * @param <T> the type
     * @param type the class of the type
     * @return the instance
     * @throws ClassCastException if the instance is not a {@code T}
     */
    public <T> T get(Class<T> type) throws ClassCastException {
        return type.cast(instance);
    }

    /** @return the class this view is typed as */
    public MetaClass getMetaClass() { return metaClass; }

    /** @return the byte offset of this view within the instance */
    public int getOffset() { return offset; }

    /**
     * View the instance as another class in its hierarchy.
     *
     * @param target class to view the instance as
     * @return view of the instance typed as {@code target}
     * @see MetaClass#applyOffset(UserObject, MetaClass)
     */
    public UserObject as(MetaClass target) {
        return isNothing() ? this : metaClass.applyOffset(this, target);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof UserObject) {
            UserObject o = (UserObject)obj;
            return instance == o.instance && offset == o.offset
                    && Objects.equals(metaClass, o.metaClass);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(instance) * 31 + offset;
    }

    @Override
    public String toString() {
        if (isNothing()) { return "<nothing>"; }
        return String.format("<%s object at +%d of %s>",
                metaClass.getName(), offset, instance);
    }
}

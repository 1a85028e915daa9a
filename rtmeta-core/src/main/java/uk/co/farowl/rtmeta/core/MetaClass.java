// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Consumer;

import uk.co.farowl.rtmeta.member.ClassVisitor;
import uk.co.farowl.rtmeta.member.Constructor;
import uk.co.farowl.rtmeta.member.Function;
import uk.co.farowl.rtmeta.member.Member;
import uk.co.farowl.rtmeta.member.Property;
import uk.co.farowl.rtmeta.support.ClassUnrelated;
import uk.co.farowl.rtmeta.support.FunctionNotFound;
import uk.co.farowl.rtmeta.support.OutOfRange;
import uk.co.farowl.rtmeta.support.PropertyNotFound;
import uk.co.farowl.rtmeta.support.internal.Util;

/**
 * The metadata of one registered class: its identity, its direct bases
 * (each with the byte offset of the base within the derived class), its
 * constructors and destructor, and its functions and properties.
 * <p>
 * A {@code MetaClass} is created by a {@link ClassBuilder} and
 * published by its {@link ClassRegistry}, which assigns the id. After
 * that nothing in it changes, so every query may be made from any
 * number of threads without locking. Functions are held sorted by
 * {@link StringId} so that lookup is a binary search. Properties are
 * held twice: sorted by {@code StringId} for lookup, and in declaration
 * order for enumeration by index.
 * <p>
 * The class owns its constructors and members and releases them when
 * the registry releases the class. It does not own its bases: a
 * {@link BaseLink} names a base by its id in the registry.
 */
public final class MetaClass {

    private final ClassRegistry registry;
    private final int id;
    private final String name;
    private final Class<?> javaClass;

    private final BaseLink[] bases;
    private final Constructor[] constructors;
    private final Consumer<Object> destructor;

    /** Sorted by {@link StringId}. */
    private final Function[] functions;
    /** Sorted by {@link StringId}. */
    private final Property[] propertiesById;
    /** In declaration order. */
    private final Property[] propertiesByIndex;

    private volatile boolean released;

    /**
     * Create a class from the tables a builder has gathered. The
     * caller (the registry) guarantees the bases are published in the
     * same registry and that member identifiers are distinct.
     *
     * @param registry that publishes the class
     * @param id assigned by the registry
     * @param b builder holding the declaration
     */
    MetaClass(ClassRegistry registry, int id, ClassBuilder b) {
        this.registry = registry;
        this.id = id;
        this.name = b.name;
        this.javaClass = b.javaClass;
        this.bases = b.bases.toArray(new BaseLink[b.bases.size()]);
        this.constructors = b.constructors
                .toArray(new Constructor[b.constructors.size()]);
        this.destructor = b.destructor;
        this.functions =
                b.functions.toArray(new Function[b.functions.size()]);
        Arrays.sort(functions,
                (f1, f2) -> f1.getId().compareTo(f2.getId()));
        this.propertiesByIndex =
                b.properties.toArray(new Property[b.properties.size()]);
        this.propertiesById = propertiesByIndex.clone();
        Arrays.sort(propertiesById,
                (p1, p2) -> p1.getId().compareTo(p2.getId()));
    }

    /** @return the identifier assigned by the registry */
    public int getId() { return id; }

    /** @return the name of the class */
    public String getName() { return name; }

    /** @return the Java class bound at declaration or {@code null} */
    public Class<?> getJavaClass() { return javaClass; }

    /** @return the registry that published this class */
    public ClassRegistry getRegistry() { return registry; }

    // Bases ----------------------------------------------------------

    /** @return the number of direct bases */
    public int baseCount() { return bases.length; }

    /**
     * Return a direct base.
     *
     * @param index of the base in declaration order
     * @return the base
     * @throws OutOfRange if {@code index >= baseCount()}
     */
    public MetaClass base(int index) throws OutOfRange {
        checkIndex(index, bases.length);
        return registry.get(bases[index].baseId());
    }

    /**
     * Return the offset of a direct base within this class.
     *
     * @param index of the base in declaration order
     * @return the byte offset of the base
     * @throws OutOfRange if {@code index >= baseCount()}
     */
    public int baseOffset(int index) throws OutOfRange {
        checkIndex(index, bases.length);
        return bases[index].offset();
    }

    // Functions ------------------------------------------------------

    /** @return the number of functions */
    public int functionCount() { return functions.length; }

    /**
     * @param id of a function
     * @return whether this class has a function with that id
     */
    public boolean hasFunction(StringId id) {
        return find(functions, id) >= 0;
    }

    /**
     * @param name of a function
     * @return whether this class has a function of that name
     */
    public boolean hasFunction(String name) {
        return hasFunction(StringId.of(name));
    }

    /**
     * Return a function by its position in identifier order (not
     * declaration order).
     *
     * @param index of the function
     * @return the function
     * @throws OutOfRange if {@code index >= functionCount()}
     */
    public Function getFunctionByIndex(int index) throws OutOfRange {
        checkIndex(index, functions.length);
        return functions[index];
    }

    /**
     * Return the function with a given id.
     *
     * @param id of the function
     * @return the function
     * @throws FunctionNotFound if there is no such function
     */
    public Function getFunctionById(StringId id) throws FunctionNotFound {
        int i = find(functions, id);
        if (i < 0) { throw new FunctionNotFound(id, name); }
        return functions[i];
    }

    /**
     * Return the function with a given name.
     *
     * @param name of the function
     * @return the function
     * @throws FunctionNotFound if there is no such function
     */
    public Function getFunction(String name) throws FunctionNotFound {
        return getFunctionById(StringId.of(name));
    }

    /**
     * Return the function with a given name, or {@code null}.
     *
     * @param name of the function
     * @return the function or {@code null} if there is no such function
     */
    public Function tryGetFunction(String name) {
        return tryGetFunctionById(StringId.of(name));
    }

    /**
     * Return the function with a given id, or {@code null}.
     *
     * @param id of the function
     * @return the function or {@code null} if there is no such function
     */
    public Function tryGetFunctionById(StringId id) {
        int i = find(functions, id);
        return i < 0 ? null : functions[i];
    }

    // Properties -----------------------------------------------------

    /** @return the number of properties */
    public int propertyCount() { return propertiesById.length; }

    /**
     * @param id of a property
     * @return whether this class has a property with that id
     */
    public boolean hasProperty(StringId id) {
        return find(propertiesById, id) >= 0;
    }

    /**
     * @param name of a property
     * @return whether this class has a property of that name
     */
    public boolean hasProperty(String name) {
        return hasProperty(StringId.of(name));
    }

    /**
     * Return a property by its position in declaration order.
     *
     * @param index of the property
     * @return the property
     * @throws OutOfRange if {@code index >= propertyCount()}
     */
    public Property getPropertyByIndex(int index) throws OutOfRange {
        checkIndex(index, propertiesByIndex.length);
        return propertiesByIndex[index];
    }

    /**
     * Return the property with a given id.
     *
     * @param id of the property
     * @return the property
     * @throws PropertyNotFound if there is no such property
     */
    public Property getPropertyById(StringId id) throws PropertyNotFound {
        int i = find(propertiesById, id);
        if (i < 0) { throw new PropertyNotFound(id, name); }
        return propertiesById[i];
    }

    /**
     * Return the property with a given name.
     *
     * @param name of the property
     * @return the property
     * @throws PropertyNotFound if there is no such property
     */
    public Property getProperty(String name) throws PropertyNotFound {
        return getPropertyById(StringId.of(name));
    }

    /**
     * Return the property with a given name, or {@code null}.
     *
     * @param name of the property
     * @return the property or {@code null} if there is no such property
     */
    public Property tryGetProperty(String name) {
        return tryGetPropertyById(StringId.of(name));
    }

    /**
     * Return the property with a given id, or {@code null}.
     *
     * @param id of the property
     * @return the property or {@code null} if there is no such property
     */
    public Property tryGetPropertyById(StringId id) {
        int i = find(propertiesById, id);
        return i < 0 ? null : propertiesById[i];
    }

    // Construction and destruction -----------------------------------

    /** @return the number of constructors */
    public int constructorCount() { return constructors.length; }

    /**
     * Create an instance using the first constructor, in registration
     * order, that matches the arguments. A later constructor is never
     * preferred, even if it matches the argument types more closely.
     *
     * @param args to the constructor
     * @return the new instance typed as this class, or
     *     {@link UserObject#NOTHING} if no constructor matches
     */
    public UserObject construct(Args args) {
        for (Constructor c : constructors) {
            if (c.matches(args)) {
                return new UserObject(c.create(args), this);
            }
        }
        return UserObject.NOTHING;
    }

    /**
     * Create an instance from an argument list given as an array.
     *
     * @param args to the constructor
     * @return the new instance or {@link UserObject#NOTHING}
     * @see #construct(Args)
     */
    public UserObject construct(Object... args) {
        return construct(Args.of(args));
    }

    /**
     * Destroy an instance of this class with the destructor bound at
     * registration. The caller is responsible for the instance being
     * one of this class.
     *
     * @param object to destroy
     */
    public void destroy(UserObject object) {
        destructor.accept(object.get());
    }

    // Visitation -----------------------------------------------------

    /**
     * Present every member to a visitor: first the properties in
     * declaration order, then the functions in identifier order.
     *
     * @param visitor to present members to
     */
    public void visit(ClassVisitor visitor) {
        for (Property p : propertiesByIndex) { p.accept(visitor); }
        for (Function f : functions) { f.accept(visitor); }
    }

    // Offsets and casting --------------------------------------------

    /**
     * Compute the byte offset to add to a pointer to this class to view
     * it as the given class. The offset is zero if {@code base} is this
     * class. Otherwise the direct bases are searched in declaration
     * order and the first that leads to {@code base} decides the
     * result: where {@code base} is reachable by more than one path, as
     * in a diamond, the path through the earliest declared direct base
     * wins.
     *
     * @param base class sought
     * @return offset, or empty if {@code base} is neither this class nor
     *     one of its (direct or indirect) bases
     */
    public OptionalInt baseOffset(MetaClass base) {
        if (base == this) { return OptionalInt.of(0); }
        for (BaseLink link : bases) {
            MetaClass b = registry.get(link.baseId());
            OptionalInt offset = b.baseOffset(base);
            if (offset.isPresent()) {
                return OptionalInt.of(link.offset() + offset.getAsInt());
            }
        }
        return OptionalInt.empty();
    }

    /**
     * @param base class sought
     * @return whether {@code base} is this class or one of its bases
     */
    public boolean derivesFrom(MetaClass base) {
        return baseOffset(base).isPresent();
    }

    /**
     * Cast a view typed as this class to a view typed as another class
     * of the same hierarchy, adjusting the offset. The target may be a
     * base of this class (the offset is added) or a class derived from
     * this one (the offset of this class within the target is
     * subtracted). {@code null} and {@link UserObject#NOTHING} are
     * returned unchanged whatever the target.
     *
     * @param object view typed as this class
     * @param target class to view the instance as
     * @return view of the same instance typed as {@code target}
     * @throws ClassUnrelated if neither class derives from the other
     */
    public UserObject applyOffset(UserObject object, MetaClass target)
            throws ClassUnrelated {
        if (object == null || object.isNothing()) { return object; }

        OptionalInt offset = baseOffset(target);
        if (offset.isPresent()) {
            return object.moved(target, offset.getAsInt());
        }

        offset = target.baseOffset(this);
        if (offset.isPresent()) {
            return object.moved(target, -offset.getAsInt());
        }

        throw new ClassUnrelated(name, target.name);
    }

    // Life cycle -----------------------------------------------------

    /**
     * Release every constructor and member this class owns. Each is
     * released even if releasing another fails: the first failure is
     * then re-thrown with the rest suppressed in it. Classes referenced
     * as bases are not affected.
     */
    void release() {
        if (released) { return; }
        released = true;
        List<Runnable> actions = new ArrayList<>(constructors.length
                + functions.length + propertiesById.length);
        for (Constructor c : constructors) { actions.add(c::release); }
        for (Member m : functions) { actions.add(m::release); }
        for (Member m : propertiesById) { actions.add(m::release); }
        Util.applyToAll(actions, Runnable::run);
    }

    /** @return whether the registry has released this class */
    public boolean isReleased() { return released; }

    /**
     * @param other class
     * @return whether this class names {@code other} as a direct base
     */
    boolean hasDirectBase(MetaClass other) {
        for (BaseLink link : bases) {
            if (other.registry == registry && link.baseId() == other.id) {
                return true;
            }
        }
        return false;
    }

    // Equality -------------------------------------------------------

    /**
     * Classes are equal if they have the same id in the same registry.
     * Ids are only unique within a registry.
     */
    @Override
    public boolean equals(Object obj) {
        if (obj instanceof MetaClass) {
            MetaClass other = (MetaClass)obj;
            return other.id == id && other.registry == registry;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(registry) * 31 + id;
    }

    @Override
    public String toString() { return name; }

    // Helpers --------------------------------------------------------

    private static void checkIndex(int index, int size) {
        if (index < 0 || index >= size) {
            throw new OutOfRange(index, size);
        }
    }

    /**
     * Binary search for a member in a table sorted by
     * {@link StringId}.
     *
     * @param table to search
     * @param id sought
     * @return index of the member or -1 if absent
     */
    private static int find(Member[] table, StringId id) {
        int lo = 0, hi = table.length;
        // Lower bound: first entry not less than id.
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (table[mid].getId().compareTo(id) < 0)
                lo = mid + 1;
            else
                hi = mid;
        }
        return lo < table.length && table[lo].getId().equals(id) ? lo
                : -1;
    }
}

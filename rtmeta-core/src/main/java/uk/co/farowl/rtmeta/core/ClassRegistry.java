// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.rtmeta.member.Member;
import uk.co.farowl.rtmeta.support.ClassNotFound;
import uk.co.farowl.rtmeta.support.RegistrationError;
import uk.co.farowl.rtmeta.support.internal.Util;

/**
 * The registry of published classes. Each {@link MetaClass} has a slot
 * in the registry, and its id is the index of that slot. A
 * {@link BaseLink} names its base by that id, so a class never holds a
 * direct reference to another.
 * <p>
 * Publication and removal are serialised by synchronising on the
 * registry. Lookup by id, which the cast algorithm performs at every
 * step, takes no lock: the slots are held in an array that is replaced
 * (copy on write) when it changes, and published through a
 * {@code volatile} field. Lookup by name or Java class is synchronised.
 * <p>
 * A slot is never reused, so an id continues to mean the same class,
 * or no class, for the life of the registry.
 */
public class ClassRegistry implements AutoCloseable {

    /** Logger for the registry. */
    static final Logger logger = LoggerFactory.getLogger(ClassRegistry.class);

    /** System property giving the initial number of slots. */
    public static final String INITIAL_CAPACITY_PROPERTY =
            "uk.co.farowl.rtmeta.initialCapacity";

    private static final int DEFAULT_CAPACITY = 16;

    /** Slot {@code i} holds the class of id {@code i} or {@code null}. */
    private volatile MetaClass[] arena;

    /** Next id to issue, which is also the number of slots used. */
    private int nextId;

    private final Map<String, MetaClass> byName = new HashMap<>();

    /** Keys are weak to allow classes to be unloaded. */
    private final Map<Class<?>, MetaClass> byJavaClass =
            new WeakHashMap<>();

    private boolean closed;

    /**
     * Create a registry with the initial capacity given by the system
     * property {@value #INITIAL_CAPACITY_PROPERTY}, or 16 slots if that
     * is not set.
     */
    public ClassRegistry() {
        this(Integer.getInteger(INITIAL_CAPACITY_PROPERTY,
                DEFAULT_CAPACITY));
    }

    /**
     * Create a registry with a given initial capacity. The registry
     * grows as necessary.
     *
     * @param initialCapacity number of slots to allocate
     */
    public ClassRegistry(int initialCapacity) {
        this.arena = new MetaClass[Math.max(initialCapacity, 1)];
        logger.atInfo().setMessage("class registry created ({} slots)")
                .addArgument(arena.length).log();
    }

    // Declaration ----------------------------------------------------

    /**
     * Begin the declaration of a class not bound to a Java class.
     *
     * @param name of the class
     * @return builder for the declaration
     */
    public ClassBuilder declare(String name) {
        return new ClassBuilder(this, name, null);
    }

    /**
     * Begin the declaration of a class bound to a Java class and named
     * by its simple name.
     *
     * @param javaClass to bind
     * @return builder for the declaration
     */
    public ClassBuilder declare(Class<?> javaClass) {
        return new ClassBuilder(this, javaClass.getSimpleName(),
                javaClass);
    }

    /**
     * Begin the declaration of a class bound to a Java class.
     *
     * @param name of the class
     * @param javaClass to bind
     * @return builder for the declaration
     */
    public ClassBuilder declare(String name, Class<?> javaClass) {
        return new ClassBuilder(this, name, javaClass);
    }

    /**
     * Create and publish a class from a completed declaration.
     *
     * @param b the declaration
     * @return the published class
     * @throws RegistrationError if the declaration is inconsistent with
     *     itself or the registry
     */
    synchronized MetaClass publish(ClassBuilder b)
            throws RegistrationError {
        if (closed) {
            throw new RegistrationError("registry closed: cannot add %s",
                    b.name);
        }
        if (byName.containsKey(b.name)) {
            throw new RegistrationError("class %s is already declared",
                    b.name);
        }
        if (b.javaClass != null && byJavaClass.containsKey(b.javaClass)) {
            throw new RegistrationError("%s is already bound to %s",
                    b.javaClass.getName(), byJavaClass.get(b.javaClass));
        }
        for (BaseLink link : b.bases) {
            if (lookup(link.baseId()) == null) {
                throw new RegistrationError(
                        "base #%d of %s is not published", link.baseId(),
                        b.name);
            }
        }
        checkDistinct(b.name, b.functions);
        checkDistinct(b.name, b.properties);

        // Allocate the slot and publish a new arena.
        int id = nextId;
        MetaClass c = new MetaClass(this, id, b);
        MetaClass[] a = arena;
        a = Arrays.copyOf(a, id < a.length ? a.length : 2 * a.length);
        a[id] = c;
        arena = a;
        nextId = id + 1;

        byName.put(c.getName(), c);
        if (b.javaClass != null) { byJavaClass.put(b.javaClass, c); }

        logger.atDebug().setMessage("published class {} as #{}")
                .addArgument(c).addArgument(id).log();
        logger.atTrace()
                .setMessage("{} has {} bases, {} properties, {} functions")
                .addArgument(c).addArgument(c::baseCount)
                .addArgument(c::propertyCount)
                .addArgument(c::functionCount).log();
        return c;
    }

    /**
     * Check that no two members of a kind in a declaration share an
     * identifier, which would defeat lookup by identifier.
     */
    private static void checkDistinct(String className,
            List<? extends Member> members) throws RegistrationError {
        Set<StringId> seen = new HashSet<>();
        for (Member m : members) {
            if (!seen.add(m.getId())) {
                throw new RegistrationError(
                        "duplicate member identifier %s (%08x) in %s",
                        m.getName(), m.getId().value(), className);
            }
        }
    }

    // Lookup ---------------------------------------------------------

    /**
     * Return the class with a given id. This does not lock the
     * registry.
     *
     * @param id of the class
     * @return the class
     * @throws ClassNotFound if no class has that id (now)
     */
    public MetaClass get(int id) throws ClassNotFound {
        MetaClass c = lookup(id);
        if (c == null) { throw new ClassNotFound("#" + id); }
        return c;
    }

    /** @return class in slot {@code id} or {@code null} */
    private MetaClass lookup(int id) {
        MetaClass[] a = arena;
        return id >= 0 && id < a.length ? a[id] : null;
    }

    /**
     * Return the class with a given name.
     *
     * @param name of the class
     * @return the class
     * @throws ClassNotFound if no class has that name
     */
    public synchronized MetaClass get(String name) throws ClassNotFound {
        MetaClass c = byName.get(name);
        if (c == null) { throw new ClassNotFound(name); }
        return c;
    }

    /**
     * Return the class with a given name, or {@code null}.
     *
     * @param name of the class
     * @return the class or {@code null} if no class has that name
     */
    public synchronized MetaClass tryGet(String name) {
        return byName.get(name);
    }

    /**
     * Return the class bound to a given Java class.
     *
     * @param javaClass bound at declaration
     * @return the class
     * @throws ClassNotFound if no class is bound to {@code javaClass}
     */
    public synchronized MetaClass get(Class<?> javaClass)
            throws ClassNotFound {
        MetaClass c = byJavaClass.get(javaClass);
        if (c == null) { throw new ClassNotFound(javaClass.getName()); }
        return c;
    }

    /**
     * Return the class of a Java object: the class bound to its Java
     * class or, failing that, to the nearest Java superclass that has
     * one.
     *
     * @param instance to classify
     * @return the class of the object
     * @throws ClassNotFound if no class is bound to the Java class of
     *     the object or any of its superclasses
     */
    public synchronized MetaClass classOf(Object instance)
            throws ClassNotFound {
        for (Class<?> k = instance.getClass(); k != null;
                k = k.getSuperclass()) {
            MetaClass c = byJavaClass.get(k);
            if (c != null) { return c; }
        }
        throw new ClassNotFound(instance.getClass().getName());
    }

    /**
     * Present a Java object as an instance of its registered class.
     *
     * @param instance to wrap
     * @return the object viewed as its class
     * @throws ClassNotFound if the object has no registered class
     */
    public UserObject wrap(Object instance) throws ClassNotFound {
        return new UserObject(instance, classOf(instance));
    }

    /** @return the number of classes published and not removed */
    public synchronized int count() { return byName.size(); }

    /** @return the classes published and not removed, in id order */
    public List<MetaClass> classes() {
        List<MetaClass> list = new ArrayList<>();
        for (MetaClass c : arena) { if (c != null) { list.add(c); } }
        return Collections.unmodifiableList(list);
    }

    // Removal --------------------------------------------------------

    /**
     * Remove a class from the registry and release its constructors and
     * members. Its id is not reused.
     *
     * @param c class to remove
     * @throws RegistrationError if another class still names {@code c}
     *     as a base, or {@code c} is not published here
     */
    public synchronized void unregister(MetaClass c)
            throws RegistrationError {
        if (c.getRegistry() != this || lookup(c.getId()) != c) {
            throw new RegistrationError("%s is not published here", c);
        }
        for (MetaClass d : arena) {
            if (d != null && d.hasDirectBase(c)) {
                throw new RegistrationError(
                        "cannot remove %s while it is a base of %s", c, d);
            }
        }
        remove(c);
        logger.atDebug().setMessage("removing class {}").addArgument(c)
                .log();
        c.release();
    }

    /** Take a class out of the lookup structures (not release it). */
    private void remove(MetaClass c) {
        MetaClass[] a = arena.clone();
        a[c.getId()] = null;
        arena = a;
        byName.remove(c.getName());
        Class<?> k = c.getJavaClass();
        if (k != null) { byJavaClass.remove(k); }
    }

    /**
     * Remove every class, most recently published first, releasing its
     * constructors and members. All classes are released even if
     * releasing some of them fails. The registry accepts no further
     * declarations.
     */
    @Override
    public synchronized void close() {
        if (closed) { return; }
        closed = true;
        List<MetaClass> all = new ArrayList<>(classes());
        Collections.reverse(all);
        logger.atDebug().setMessage("closing registry of {} classes")
                .addArgument(all.size()).log();
        for (MetaClass c : all) { remove(c); }
        Util.applyToAll(all, MetaClass::release);
    }

    /** @return whether {@link #close()} has been called */
    public synchronized boolean isClosed() { return closed; }
}

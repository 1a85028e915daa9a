// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import uk.co.farowl.rtmeta.member.Constructor;
import uk.co.farowl.rtmeta.member.Function;
import uk.co.farowl.rtmeta.member.Property;
import uk.co.farowl.rtmeta.support.RegistrationError;
import uk.co.farowl.rtmeta.support.internal.Util;

/**
 * Gathers the declaration of one class: bases, constructors,
 * destructor and members. {@link #publish()} hands the declaration to
 * the {@link ClassRegistry} that issued the builder, which creates the
 * {@link MetaClass}. A builder may be published only once.
 * <p>
 * A builder is not thread-safe. It is expected to be filled and
 * published by one thread.
 */
public final class ClassBuilder {

    private final ClassRegistry registry;

    final String name;
    final Class<?> javaClass;
    final List<BaseLink> bases = new ArrayList<>();
    final List<Constructor> constructors = new ArrayList<>();
    Consumer<Object> destructor = ClassBuilder::closeIfCloseable;
    final List<Function> functions = new ArrayList<>();
    final List<Property> properties = new ArrayList<>();

    private boolean published;

    /**
     * Start the declaration of a class.
     *
     * @param registry that will publish the class
     * @param name of the class
     * @param javaClass bound to the class or {@code null}
     */
    ClassBuilder(ClassRegistry registry, String name,
            Class<?> javaClass) {
        this.registry = registry;
        this.name = Objects.requireNonNull(name, "name");
        this.javaClass = javaClass;
    }

    /**
     * Add a direct base, found at a byte offset within the class being
     * declared.
     *
     * @param base published in the same registry
     * @param offset of the base within this class
     * @return {@code this}
     * @throws RegistrationError if {@code base} is from another registry
     */
    public ClassBuilder base(MetaClass base, int offset)
            throws RegistrationError {
        checkOpen();
        if (base.getRegistry() != registry) {
            throw new RegistrationError(
                    "base %s of %s is from another registry", base, name);
        }
        bases.add(new BaseLink(base.getId(), offset));
        return this;
    }

    /**
     * Add a direct base at offset zero.
     *
     * @param base published in the same registry
     * @return {@code this}
     */
    public ClassBuilder base(MetaClass base) { return base(base, 0); }

    /**
     * Add a constructor. Constructors are tried in the order added.
     *
     * @param constructor to add
     * @return {@code this}
     */
    public ClassBuilder constructor(Constructor constructor) {
        checkOpen();
        constructors.add(Objects.requireNonNull(constructor));
        return this;
    }

    /**
     * Set the action that destroys an instance. The default closes
     * instances that are {@code AutoCloseable} and otherwise does
     * nothing.
     *
     * @param destructor to apply to instances
     * @return {@code this}
     */
    public ClassBuilder destructor(Consumer<Object> destructor) {
        checkOpen();
        this.destructor = Objects.requireNonNull(destructor);
        return this;
    }

    /**
     * Add a property. Properties are indexed in the order added.
     *
     * @param property to add
     * @return {@code this}
     */
    public ClassBuilder property(Property property) {
        checkOpen();
        properties.add(Objects.requireNonNull(property));
        return this;
    }

    /**
     * Add a function.
     *
     * @param function to add
     * @return {@code this}
     */
    public ClassBuilder function(Function function) {
        checkOpen();
        functions.add(Objects.requireNonNull(function));
        return this;
    }

    /**
     * Publish the class in the registry, which assigns its id.
     *
     * @return the published class
     * @throws RegistrationError if the declaration is inconsistent with
     *     itself or the registry
     */
    public MetaClass publish() throws RegistrationError {
        checkOpen();
        published = true;
        return registry.publish(this);
    }

    private void checkOpen() {
        if (published) {
            throw new RegistrationError("class %s already published",
                    name);
        }
    }

    private static void closeIfCloseable(Object instance) {
        if (instance instanceof AutoCloseable) {
            try {
                ((AutoCloseable)instance).close();
            } catch (Exception e) {
                throw Util.asUnchecked(e, "during destruction of %s",
                        instance);
            }
        }
    }
}

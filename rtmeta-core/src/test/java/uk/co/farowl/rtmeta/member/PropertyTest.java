// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.member;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import uk.co.farowl.rtmeta.core.ClassRegistry;
import uk.co.farowl.rtmeta.core.MetaClass;
import uk.co.farowl.rtmeta.core.StringId;
import uk.co.farowl.rtmeta.core.UserObject;
import uk.co.farowl.rtmeta.support.BadType;
import uk.co.farowl.rtmeta.support.ForbiddenWrite;
import uk.co.farowl.rtmeta.support.NullObject;
import uk.co.farowl.rtmeta.support.OutOfRange;
import uk.co.farowl.rtmeta.support.RegistrationError;

/**
 * Tests of the kinds of {@link Property}, made from the fields of
 * {@link Bean}.
 */
@DisplayName("A property")
class PropertyTest {

    static final Lookup LOOKUP = MethodHandles.lookup();

    /** A class with fields of each kind. */
    static class Bean {
        int count = 1;
        final String name = "bean";
        int[] values = {1, 2, 3};
        int[] missing = null;
        List<String> words = new ArrayList<>(List.of("a", "b"));
        List<String> fixed = List.of("x");
        String notSequence = "abc";
        Node node = null;
        static int instances;
    }

    /** A class whose instances are the values of a user property. */
    static class Node {
        final String tag;

        Node(String tag) { this.tag = tag; }
    }

    ClassRegistry registry;
    MetaClass beanClass, nodeClass;
    Bean bean;
    UserObject object;

    @BeforeEach
    void setUp() {
        registry = new ClassRegistry();
        beanClass = registry.declare(Bean.class).publish();
        nodeClass = registry.declare(Node.class).publish();
        bean = new Bean();
        object = new UserObject(bean, beanClass);
    }

    @Nested
    @DisplayName("of a simple value")
    class Simple {

        SimpleProperty count =
                SimpleProperty.forField(LOOKUP, Bean.class, "count");
        SimpleProperty name =
                SimpleProperty.forField(LOOKUP, Bean.class, "name");

        @Test
        void describesItself() {
            assertEquals("count", count.getName());
            assertEquals(StringId.of("count"), count.getId());
            assertSame(int.class, count.getType());
            assertTrue(count.isWritable());
            assertFalse(name.isWritable());
            assertEquals("<SimpleProperty count: int>", count.toString());
        }

        @Test
        void getAndSet() {
            assertEquals(1, count.get(object));
            count.set(object, 5);
            assertEquals(5, bean.count);
            // Numeric types convert
            count.set(object, 7L);
            assertEquals(7, count.get(object));
        }

        @Test
        void finalFieldIsReadOnly() {
            assertEquals("bean", name.get(object));
            ForbiddenWrite e = assertThrows(ForbiddenWrite.class,
                    () -> name.set(object, "other"));
            assertEquals("name", e.getProperty());
        }

        @Test
        void badValueType() {
            BadType e = assertThrows(BadType.class,
                    () -> count.set(object, "five"));
            assertSame(int.class, e.getExpected());
            assertThrows(BadType.class, () -> count.set(object, null));
            assertEquals(1, bean.count);
        }

        @Test
        void nullObject() {
            assertThrows(NullObject.class, () -> count.get(null));
            NullObject e = assertThrows(NullObject.class,
                    () -> count.get(UserObject.NOTHING));
            assertEquals("count", e.getMember());
            assertThrows(NullObject.class,
                    () -> count.set(UserObject.NOTHING, 1));
        }

        @Test
        void fromHandles() throws ReflectiveOperationException {
            MethodHandle getter =
                    LOOKUP.findGetter(Bean.class, "count", int.class);
            SimpleProperty p = SimpleProperty.of("n", getter, null);
            assertSame(int.class, p.getType());
            assertFalse(p.isWritable());
            assertEquals(1, p.get(object));
        }

        @Test
        void unusableFields() {
            assertThrows(RegistrationError.class, () -> SimpleProperty
                    .forField(LOOKUP, Bean.class, "instances"));
            RegistrationError e = assertThrows(RegistrationError.class,
                    () -> SimpleProperty.forField(LOOKUP, Bean.class,
                            "absent"));
            assertInstanceOf(NoSuchFieldException.class, e.getCause());
        }

        @Test
        void releasedIsUnusable() {
            count.release();
            assertTrue(count.isReleased());
            assertThrows(IllegalStateException.class,
                    () -> count.get(object));
            assertThrows(IllegalStateException.class,
                    () -> count.set(object, 2));
        }
    }

    @Nested
    @DisplayName("of a sequence")
    class Sequence {

        ArrayProperty values =
                ArrayProperty.forField(LOOKUP, Bean.class, "values");
        ArrayProperty missing =
                ArrayProperty.forField(LOOKUP, Bean.class, "missing");
        ArrayProperty words =
                ArrayProperty.forField(LOOKUP, Bean.class, "words");
        ArrayProperty fixed =
                ArrayProperty.forField(LOOKUP, Bean.class, "fixed");

        @Test
        void elementType() {
            assertSame(int.class, values.getElementType());
            assertSame(int[].class, values.getType());
            assertSame(Object.class, words.getElementType());
        }

        @Test
        void arrayElements() {
            assertEquals(3, values.size(object));
            assertEquals(2, values.getElement(object, 1));
            values.setElement(object, 1, 20L);
            assertEquals(20, bean.values[1]);
        }

        @Test
        void listElements() {
            assertEquals(2, words.size(object));
            assertEquals("b", words.getElement(object, 1));
            words.setElement(object, 0, "z");
            assertEquals(List.of("z", "b"), bean.words);
        }

        @Test
        void wholeValue() {
            int[] replacement = {9};
            values.set(object, replacement);
            assertSame(replacement, values.get(object));
            assertEquals(1, values.size(object));
        }

        @Test
        void outOfRange() {
            OutOfRange e = assertThrows(OutOfRange.class,
                    () -> values.getElement(object, 3));
            assertEquals(3, e.getIndex());
            assertEquals(3, e.getSize());
            assertThrows(OutOfRange.class,
                    () -> words.setElement(object, -1, "q"));
        }

        @Test
        void nullSequenceIsEmpty() {
            assertEquals(0, missing.size(object));
            assertThrows(OutOfRange.class,
                    () -> missing.getElement(object, 0));
        }

        @Test
        void unmodifiableList() {
            assertThrows(ForbiddenWrite.class,
                    () -> fixed.setElement(object, 0, "y"));
        }

        @Test
        void notASequence() {
            assertThrows(RegistrationError.class, () -> ArrayProperty
                    .forField(LOOKUP, Bean.class, "notSequence"));
            assertThrows(RegistrationError.class,
                    () -> ArrayProperty.of("n", Object.class,
                            LOOKUP.findGetter(Bean.class, "count",
                                    int.class),
                            null));
        }
    }

    @Nested
    @DisplayName("of a registered class")
    class User {

        UserProperty node;

        @BeforeEach
        void makeProperty() throws ReflectiveOperationException {
            node = UserProperty.of("node", nodeClass,
                    LOOKUP.findGetter(Bean.class, "node", Node.class),
                    LOOKUP.findSetter(Bean.class, "node", Node.class));
        }

        @Test
        void nullIsNothing() {
            assertSame(UserObject.NOTHING, node.get(object));
            assertSame(nodeClass, node.getValueClass());
        }

        @Test
        void valueIsTaggedWithItsClass() {
            Node n = new Node("n1");
            bean.node = n;
            UserObject v = (UserObject)node.get(object);
            assertSame(n, v.get());
            assertSame(nodeClass, v.getMetaClass());
            assertEquals("n1", v.get(Node.class).tag);
        }

        @Test
        void acceptsUserObjectOrInstance() {
            Node n1 = new Node("n1"), n2 = new Node("n2");
            node.set(object, new UserObject(n1, nodeClass));
            assertSame(n1, bean.node);
            node.set(object, n2);
            assertSame(n2, bean.node);
            node.set(object, null);
            assertSame(UserObject.NOTHING, node.get(object));
        }

        @Test
        void rejectsOtherTypes() {
            assertThrows(BadType.class, () -> node.set(object, "n3"));
        }
    }

    @Test
    @DisplayName("is presented to the matching visitor method")
    void doubleDispatch() throws ReflectiveOperationException {
        List<String> seen = new ArrayList<>();
        ClassVisitor visitor = new ClassVisitor() {
            @Override
            public void visit(SimpleProperty p) { seen.add("simple"); }

            @Override
            public void visit(ArrayProperty p) { seen.add("array"); }

            @Override
            public void visit(UserProperty p) { seen.add("user"); }
        };
        SimpleProperty.forField(LOOKUP, Bean.class, "count")
                .accept(visitor);
        ArrayProperty.forField(LOOKUP, Bean.class, "values")
                .accept(visitor);
        UserProperty.of("node", nodeClass,
                LOOKUP.findGetter(Bean.class, "node", Node.class), null)
                .accept(visitor);
        assertEquals(List.of("simple", "array", "user"), seen);
    }
}

// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.rtmeta.member;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.Method;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import uk.co.farowl.rtmeta.core.Args;
import uk.co.farowl.rtmeta.core.ClassRegistry;
import uk.co.farowl.rtmeta.core.MetaClass;
import uk.co.farowl.rtmeta.core.StringId;
import uk.co.farowl.rtmeta.core.UserObject;
import uk.co.farowl.rtmeta.support.BadType;
import uk.co.farowl.rtmeta.support.InvocationError;
import uk.co.farowl.rtmeta.support.NotEnoughArguments;
import uk.co.farowl.rtmeta.support.NullObject;
import uk.co.farowl.rtmeta.support.OutOfRange;
import uk.co.farowl.rtmeta.support.RegistrationError;

/** Tests of {@link Function}, made from the methods of {@link Calc}. */
@DisplayName("A function")
class FunctionTest {

    static final Lookup LOOKUP = MethodHandles.lookup();

    /** A class with methods to expose. */
    static class Calc {
        int base = 100;
        int calls;

        int add(int a, int b) { return base + a + b; }

        void touch() { calls += 1; }

        double half(double x) { return x / 2; }

        void failChecked() throws IOException {
            throw new IOException("disk on fire");
        }

        void failUnchecked() { throw new IllegalArgumentException("bad"); }

        static String greet(String who) { return "hello " + who; }
    }

    static Function function(String name, Class<?>... parameterTypes) {
        try {
            Method m = Calc.class.getDeclaredMethod(name, parameterTypes);
            return Function.forMethod(LOOKUP, m);
        } catch (NoSuchMethodException e) {
            throw new AssertionError(e);
        }
    }

    MetaClass calcClass;
    Calc calc;
    UserObject object;

    @BeforeEach
    void setUp() {
        calcClass = new ClassRegistry().declare(Calc.class).publish();
        calc = new Calc();
        object = new UserObject(calc, calcClass);
    }

    @Nested
    @DisplayName("made from an instance method")
    class Instance {

        Function add = function("add", int.class, int.class);

        @Test
        void describesItself() {
            assertEquals("add", add.getName());
            assertEquals(StringId.of("add"), add.getId());
            assertEquals(2, add.arity());
            assertFalse(add.isStatic());
            assertSame(int.class, add.getReturnType());
            assertSame(int.class, add.getParameterType(1));
            assertEquals("<function add/2>", add.toString());
        }

        @Test
        void parameterOutOfRange() {
            OutOfRange e = assertThrows(OutOfRange.class,
                    () -> add.getParameterType(2));
            assertEquals(2, e.getSize());
        }

        @Test
        void call() {
            assertEquals(103, add.call(object, Args.of(1, 2)));
            calc.base = 0;
            assertEquals(3, add.call(object, Args.of(1, 2)));
        }

        @Test
        void argumentsConvert() {
            assertEquals(103, add.call(object, Args.of(1L, (short)2)));
            assertEquals(1.5,
                    function("half", double.class).call(object,
                            Args.of(3)));
            assertThrows(BadType.class,
                    () -> add.call(object, Args.of("1", 2)));
        }

        @Test
        void surplusArgumentsIgnored() {
            assertEquals(103, add.call(object, Args.of(1, 2, "extra")));
        }

        @Test
        void tooFewArguments() {
            NotEnoughArguments e = assertThrows(NotEnoughArguments.class,
                    () -> add.call(object, Args.of(1)));
            assertEquals("add", e.getMember());
            assertEquals(1, e.getProvided());
            assertEquals(2, e.getExpected());
        }

        @Test
        void voidReturnsNull() {
            Function touch = function("touch");
            assertSame(void.class, touch.getReturnType());
            assertNull(touch.call(object, Args.EMPTY));
            assertEquals(1, calc.calls);
        }

        @Test
        void needsAnInstance() {
            assertThrows(NullObject.class,
                    () -> add.call(UserObject.NOTHING, Args.of(1, 2)));
            assertThrows(NullObject.class,
                    () -> add.call(null, Args.of(1, 2)));
        }

        @Test
        void releasedIsUnusable() {
            add.release();
            assertTrue(add.isReleased());
            assertThrows(IllegalStateException.class,
                    () -> add.call(object, Args.of(1, 2)));
        }
    }

    @Nested
    @DisplayName("made from a static method")
    class Static {

        Function greet = function("greet", String.class);

        @Test
        void needsNoInstance() {
            assertTrue(greet.isStatic());
            assertEquals(1, greet.arity());
            assertSame(String.class, greet.getParameterType(0));
            assertEquals("hello you",
                    greet.call(UserObject.NOTHING, Args.of("you")));
            assertEquals("hello me", greet.call(object, Args.of("me")));
            assertEquals("hello null", greet.call(null, Args.of(
                    (Object)null)));
        }

        @Test
        void fromHandle() {
            Function k = Function.ofStatic("k",
                    MethodHandles.constant(int.class, 42));
            assertEquals(0, k.arity());
            assertEquals(42, k.call(null, Args.EMPTY));
        }
    }

    @Nested
    @DisplayName("that throws")
    class Throwing {

        @Test
        void checkedIsWrapped() {
            Function f = function("failChecked");
            InvocationError e = assertThrows(InvocationError.class,
                    () -> f.call(object, Args.EMPTY));
            assertInstanceOf(IOException.class, e.getCause());
            assertEquals("during call to failChecked", e.getMessage());
        }

        @Test
        void uncheckedPropagates() {
            Function f = function("failUnchecked");
            IllegalArgumentException e = assertThrows(
                    IllegalArgumentException.class,
                    () -> f.call(object, Args.EMPTY));
            assertEquals("bad", e.getMessage());
        }
    }

    @Test
    @DisplayName("must have a receiver parameter")
    void noReceiver() {
        assertThrows(RegistrationError.class, () -> Function.of("k",
                MethodHandles.constant(int.class, 42)));
    }
}

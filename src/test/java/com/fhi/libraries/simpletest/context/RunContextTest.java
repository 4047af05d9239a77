package com.fhi.libraries.simpletest.context;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fhi.libraries.simpletest.exception.SimpleTestException;
import com.fhi.libraries.simpletest.reporter.Reporter;
import com.fhi.libraries.simpletest.reporter.TextReporter;

import static org.junit.jupiter.api.Assertions.*;

class RunContextTest
{
    private RunContext context;

    @BeforeEach
    void setup()
    {   context = new RunContext();
        context.register(Helper.class, Helper::new);
    }


    @DisplayName("Two get() calls in the same run share one instance")
    @Test
    void resourceIsStableWithinARun()
    {   assertSame(context.get(Helper.class), context.get(Helper.class));
    }

    @DisplayName("Switching the test empties the resource cache")
    @Test
    void setTestIsolatesResources()
    {
        Helper x1 = context.get(Helper.class);

        context.setTest(() -> "SecondTest");
        Helper x2 = context.get(Helper.class);

        assertNotSame(x1, x2);
        assertEquals("SecondTest", context.getTest().orElseThrow().getLabel());
    }

    @Test
    void setReporterIsolatesResources()
    {
        Helper x1 = context.get(Helper.class);
        Reporter reporter = new TextReporter();

        context.setReporter(reporter);

        assertNotSame(x1, context.get(Helper.class));
        assertSame(reporter, context.getReporter().orElseThrow());
    }

    @Test
    void clearKeepsTestAndReporter()
    {
        TestCase test = () -> "FirstTest";
        Reporter reporter = new TextReporter();
        context.setTest(test);
        context.setReporter(reporter);
        Helper x1 = context.get(Helper.class);

        context.clear();

        assertSame(test, context.getTest().orElseThrow());
        assertSame(reporter, context.getReporter().orElseThrow());
        assertNotSame(x1, context.get(Helper.class));
    }

    @Test
    void absentTestAndReporter()
    {
        assertTrue(context.getTest().isEmpty());
        assertTrue(context.getReporter().isEmpty());
    }

    @Test
    void factoryRunsOncePerRun()
    {
        AtomicInteger built = new AtomicInteger();
        context.register(Counter.class, () -> new Counter(built.incrementAndGet()));

        context.get(Counter.class);
        context.get(Counter.class);
        assertEquals(1, built.get());

        context.clear();
        assertEquals(2, context.get(Counter.class).serial);
        assertTrue(context.isRegistered(Counter.class));
    }

    @Test
    void unregisteredKindIsAProgrammerError()
    {
        SimpleTestException e = assertThrows(SimpleTestException.class, () -> context.get(Counter.class));

        assertEquals(SimpleTestException.Cause.UNKNOWN_RESOURCE, e.getCauseEnum());
        assertTrue(e.getMessage().contains(Counter.class.getName()));
    }

    @Test
    void factoryReturningNullIsAProgrammerError()
    {
        context.register(Counter.class, () -> null);

        SimpleTestException e = assertThrows(SimpleTestException.class, () -> context.get(Counter.class));

        assertEquals(SimpleTestException.Cause.RESOURCE_CONSTRUCTION, e.getCauseEnum());
    }


    @DisplayName("A new run shares the factories but not the test, the reporter or the resources")
    @Test
    void newRunIsIsolated()
    {
        context.setTest(() -> "FirstTest");
        context.setReporter(new TextReporter());
        Helper x1 = context.get(Helper.class);

        RunContext other = context.newRun();

        assertTrue(other.getTest().isEmpty());
        assertTrue(other.getReporter().isEmpty());
        assertNotSame(x1, other.get(Helper.class));
        assertSame(x1, context.get(Helper.class));

        other.setTest(() -> "SecondTest");
        assertEquals("FirstTest", context.getTest().orElseThrow().getLabel());

        context.register(Counter.class, () -> new Counter(7));
        assertEquals(7, other.get(Counter.class).serial);
    }


    static class Helper
    {
    }

    static class Counter
    {
        final int serial;

        Counter(int serial)
        {   this.serial = serial;
        }
    }
}

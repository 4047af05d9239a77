package com.fhi.libraries.simpletest;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fhi.libraries.simpletest.context.RunContext;
import com.fhi.libraries.simpletest.reflection.ClassHierarchy;
import com.fhi.libraries.simpletest.registry.TestRegistry;
import com.fhi.libraries.simpletest.reporter.Reporter;
import com.fhi.libraries.simpletest.reporter.XmlReporter;
import com.fhi.libraries.simpletest.stacktrace.StackFrame;
import com.fhi.libraries.simpletest.stacktrace.StackTracer;

import static org.junit.jupiter.api.Assertions.*;

class SimpleTestTest
{
    // Child -> Base -> Root
    private static final Map<String, String> PARENTS = Map.of("Child", "Base", "Base", "Root");

    private SimpleTest simpleTest;

    @BeforeEach
    void setup()
    {
        ClassHierarchy hierarchy = className -> Optional.ofNullable(PARENTS.get(className));
        simpleTest = new SimpleTest(TestRegistry.withDefaults(),
                                    new RunContext(),
                                    hierarchy,
                                    new StackTracer(List.of("assert"), "lib/simpletest"));
    }


    @DisplayName("The parent of an ignored class gets ignored too")
    @Test
    void parentOfIgnoredClassIsIgnored()
    {
        // GIVEN
        simpleTest.ignore("Child");

        // WHEN
        simpleTest.ignoreParentsIfIgnored(List.of("Child"));

        // THEN
        assertTrue(simpleTest.isIgnored("Base"));
        assertTrue(simpleTest.isIgnored("base"));
    }

    @Test
    void parentOfRunnableClassIsNotIgnored()
    {
        simpleTest.ignoreParentsIfIgnored(List.of("Child"));

        assertFalse(simpleTest.isIgnored("Base"));
        assertFalse(simpleTest.isIgnored("Child"));
    }

    @DisplayName("A facade for another run shares the registry but not the run context")
    @Test
    void forRunSharesRegistryOnly()
    {
        SimpleTest run = simpleTest.forRun();
        simpleTest.ignore("Child");

        assertTrue(run.isIgnored("Child"));
        assertSame(simpleTest.getRegistry(), run.getRegistry());
        assertSame(simpleTest.getStackTracer(), run.getStackTracer());
        assertNotSame(simpleTest.getContext(), run.getContext());
    }

    @DisplayName("A single call ascends one generation only")
    @Test
    void oneGenerationPerCall()
    {
        simpleTest.ignore("Child");

        simpleTest.ignoreParentsIfIgnored(List.of("Child"));
        assertFalse(simpleTest.isIgnored("Root"));

        simpleTest.ignoreParentsIfIgnored(List.of("Base"));
        assertTrue(simpleTest.isIgnored("Root"));
    }

    @Test
    void childBeforeParentListPropagatesAllTheWay()
    {
        simpleTest.ignore("Child");

        simpleTest.ignoreParentsIfIgnored(List.of("Child", "Base", "Root"));

        assertTrue(simpleTest.isIgnored("Base"));
        assertTrue(simpleTest.isIgnored("Root"));
    }

    @Test
    void classWithoutParentIsHarmless()
    {
        simpleTest.ignore("Root");

        simpleTest.ignoreParentsIfIgnored(List.of("Root", "Unknown"));

        assertEquals(1, simpleTest.getRegistry().getIgnoreList().size());
    }

    @Test
    void forwardsPlainOptions()
    {
        simpleTest.useProxy("http://proxy:3128");
        assertEquals("http://proxy:3128", simpleTest.getDefaultProxy());
        assertNull(simpleTest.getDefaultProxyUsername());

        simpleTest.useProxy("http://proxy:3128", "me", "secret");
        assertEquals("me", simpleTest.getDefaultProxyUsername());
        assertEquals("secret", simpleTest.getDefaultProxyPassword());

        simpleTest.setParsers(List.of("tidy"));
        assertEquals(List.of("tidy"), simpleTest.getParsers());
    }

    @SuppressWarnings("deprecation")
    @Test
    void mockBaseClassIsKeptForOldCallers()
    {
        assertEquals("SimpleMock", simpleTest.getMockBaseClass());
        simpleTest.setMockBaseClass("MyMock");
        assertEquals("MyMock", simpleTest.getMockBaseClass());
    }

    @Test
    void preferredForwardsToTheRegistry()
    {
        assertInstanceOf(XmlReporter.class, simpleTest.preferred(Reporter.class).orElseThrow());

        Reporter mine = event -> { };
        simpleTest.prefer(mine, Reporter.class);

        assertSame(mine, simpleTest.preferred(Reporter.class).orElseThrow());
        assertSame(mine, simpleTest.preferredAny(String.class, Reporter.class).orElseThrow());
        assertTrue(simpleTest.preferredAny(String.class).isEmpty());
    }

    @Test
    void traceMethodUsesTheConfiguredTracer()
    {
        List<StackFrame> stack = List.of(
                StackFrame.of("lib/simpletest/unit_tester.php", 1, "assertTrue"),
                StackFrame.of("tests/UserTest.php", 42, "assertHelper"));

        assertEquals(" at [tests/UserTest.php line 42]", simpleTest.traceMethod(stack));
    }

    @Test
    void withDefaultsSkipsTheFrameworkPackage()
    {
        SimpleTest defaults = SimpleTest.withDefaults();

        assertEquals("com/fhi/libraries/simpletest", defaults.getStackTracer().getFrameworkDirectory());
        assertEquals(SimpleTest.DEFAULT_TRACE_PREFIXES, defaults.getStackTracer().getPrefixes());
        assertNull(defaults.getDefaultProxy());
        assertNotSame(defaults.getContext(), SimpleTest.withDefaults().getContext());
    }

    @Test
    void versionIsReadFromTheClasspath()
    {   assertEquals("1.1.0", SimpleTest.getVersion());
    }
}

package com.fhi.libraries.simpletest.context;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import com.fhi.libraries.simpletest.exception.SimpleTestException;
import com.fhi.libraries.simpletest.reporter.Reporter;

import lombok.extern.slf4j.Slf4j;


/**
 * Container for all components of a specific test run.
 *
 * <p>Holds the active test case and the active reporter, so that mock objects can send messages to them
 * without explicit wiring, and a cache of run-scoped singleton resources. Switching the test or the reporter
 * empties that cache: resources never leak from one test into the next.</p>
 *
 * <p>Resources are built by factories registered up front with {@link #register(Class, Supplier)}; the
 * registrations themselves outlive {@link #clear()}.</p>
 *
 * <p>Tests running in parallel each need their own context; {@link #newRun()} derives one that shares the
 * factory registrations but nothing else.</p>
 */
@Slf4j
public class RunContext
{
    private volatile TestCase test;

    private volatile Reporter reporter;

    private final Map<Class<?>, Supplier<?>> factories;

    private final Map<Class<?>, Object> resources = new ConcurrentHashMap<>();


    public RunContext()
    {   this(new ConcurrentHashMap<>());
    }

    private RunContext(Map<Class<?>, Supplier<?>> factories)
    {   this.factories = factories;
    }


    /**
     * A context for another run: no test, no reporter, an empty resource cache, and the same factory
     * registrations as this one. Factories registered later on either context are seen by both.
     */
    public RunContext newRun()
    {   return new RunContext(factories);
    }


    /**
     * Clears down the resource cache. The test and reporter are left in place.
     */
    public void clear()
    {   log.trace("Clearing {} cached resources", resources.size());
        resources.clear();
    }

    /**
     * Sets the current test case instance.
     */
    public void setTest(TestCase test)
    {   clear();
        this.test = test;
    }

    public Optional<TestCase> getTest()
    {   return Optional.ofNullable(test);
    }

    /**
     * Sets the current reporter.
     */
    public void setReporter(Reporter reporter)
    {   clear();
        this.reporter = reporter;
    }

    public Optional<Reporter> getReporter()
    {   return Optional.ofNullable(reporter);
    }


    /**
     * Registers the zero-argument factory for a resource kind, replacing any earlier one.
     */
    public <T> void register(Class<T> kind, Supplier<? extends T> factory)
    {   log.debug("Registering resource factory for {}", kind.getName());
        factories.put(kind, factory);
    }

    public boolean isRegistered(Class<?> kind)
    {   return factories.containsKey(kind);
    }

    /**
     * Accessor for a run-scoped singleton resource: built on first use in the current run, then shared.
     *
     * @throws SimpleTestException if no factory is registered for {@code kind}, or the factory returned null
     */
    public <T> T get(Class<T> kind)
    {
        Object resource = resources.get(kind);
        if (resource == null)
        {   // built outside the map, so a factory may itself ask for other resources
            Supplier<?> factory = factories.get(kind);
            if (factory == null) {
                throw SimpleTestException.unknownResource(kind);
            }
            Object created = factory.get();
            if (created == null) {
                throw SimpleTestException.resourceConstruction(kind);
            }
            Object previous = resources.putIfAbsent(kind, created);
            if (previous == null) {
                log.debug("Created run resource {}", kind.getSimpleName());
            }
            resource = previous != null ? previous : created;
        }
        return kind.cast(resource);
    }
}

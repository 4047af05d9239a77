package com.fhi.libraries.simpletest.junit;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ConditionEvaluationResult;
import org.junit.jupiter.api.extension.ExecutionCondition;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.opentest4j.TestAbortedException;

import com.fhi.libraries.simpletest.SimpleTest;
import com.fhi.libraries.simpletest.context.RunContext;
import com.fhi.libraries.simpletest.reporter.Reporter;
import com.fhi.libraries.simpletest.reporter.TestEvent;

import lombok.extern.slf4j.Slf4j;

/**
 * JUnit 5 extension that wires test classes into the framework's shared state.
 *
 * <ul>
 *   <li>classes marked {@link IgnoredTestCase} go on the ignore list, and their parents with them;
 *       an ignored class is not run</li>
 *   <li>each test gets a run context of its own, holding the current test and the shared context's
 *       reporter, or else the preferred {@link Reporter}</li>
 *   <li>after each test the outcome is sent to the active reporter: failed assertions as FAIL with their
 *       failure point, aborted tests (failed assumptions) as SKIP, anything else thrown as ERROR</li>
 *   <li>test and lifecycle methods can declare {@link SimpleTest} or {@link RunContext} parameters</li>
 * </ul>
 *
 * <p>Since every test has its own context, test classes may run with JUnit's parallel execution.</p>
 *
 * <p>Register with {@code @ExtendWith(SimpleTestExtension.class)}.</p>
 */
@Slf4j
public class SimpleTestExtension implements ExecutionCondition, BeforeEachCallback, AfterEachCallback, ParameterResolver
{
    // JUnit creates extensions itself, so the facade can't be injected. The shared one is kept in the root
    // store for the whole engine run, the per-test one in the test method's store.
    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(SimpleTestExtension.class);

    // Store lookups fall through to parent stores, so the two need different keys.
    private static final String SHARED_KEY = "shared";
    private static final String RUN_KEY = "run";


    @Override
    public ConditionEvaluationResult evaluateExecutionCondition(ExtensionContext context)
    {
        if (context.getTestClass().isEmpty() || context.getTestMethod().isPresent()) {
            return ConditionEvaluationResult.enabled("");
        }
        Class<?> testClass = context.getRequiredTestClass();
        SimpleTest simpleTest = shared(context);

        // Child before parent, so a single pass propagates all the way up the chain.
        List<String> chain = new ArrayList<>();
        for (Class<?> c = testClass; c != null && c != Object.class; c = c.getSuperclass())
        {   if (c.isAnnotationPresent(IgnoredTestCase.class)) {
                simpleTest.ignore(c.getName());
            }
            chain.add(c.getName());
        }
        simpleTest.ignoreParentsIfIgnored(chain);

        if (simpleTest.isIgnored(testClass.getName()))
        {   log.debug("Skipping ignored test case {}", testClass.getName());
            return ConditionEvaluationResult.disabled(testClass.getSimpleName() + " is on the ignore list");
        }
        return ConditionEvaluationResult.enabled("");
    }


    @Override
    public void beforeEach(ExtensionContext context)
    {
        SimpleTest sharedFacade = shared(context);
        SimpleTest simpleTest = sharedFacade.forRun();
        RunContext runContext = simpleTest.getContext();

        sharedFacade.getContext().getReporter()
              .or(() -> sharedFacade.preferred(Reporter.class))
              .ifPresent(runContext::setReporter);
        runContext.setTest(new JUnitTestCase(context.getRequiredTestClass(),
                                             label(context),
                                             context.getTestInstance().orElse(null)));
        context.getStore(NAMESPACE).put(RUN_KEY, simpleTest);
    }


    @Override
    public void afterEach(ExtensionContext context)
    {
        SimpleTest simpleTest = simpleTest(context);
        Reporter reporter = simpleTest.getContext().getReporter().orElse(null);
        if (reporter == null) return;

        String label = label(context);
        TestEvent event = context.getExecutionException()
                .map(t -> toEvent(label, t, simpleTest))
                .orElseGet(() -> TestEvent.pass(label));
        reporter.report(event);
    }

    static TestEvent toEvent(String label, Throwable t, SimpleTest simpleTest)
    {
        String message = Objects.toString(t.getMessage(), "");
        if (t instanceof TestAbortedException) {
            return TestEvent.skip(label, message);
        }
        if (t instanceof AssertionError) {
            return TestEvent.fail(label, (message + simpleTest.traceFailure(t)).strip());
        }
        String type = t.getClass().getSimpleName();
        return TestEvent.error(label, (message.isEmpty() ? type : type + ": " + message) + simpleTest.traceFailure(t));
    }


    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext)
    {
        Class<?> type = parameterContext.getParameter().getType();
        return type == SimpleTest.class || type == RunContext.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext)
    {
        SimpleTest simpleTest = simpleTest(extensionContext);
        return parameterContext.getParameter().getType() == RunContext.class ? simpleTest.getContext() : simpleTest;
    }


    /**
     * The facade of the current test, or outside a test (e.g. in {@code @BeforeAll}) the one shared by all test
     * classes of the engine run. Both share the registry; each test has its own {@link RunContext}.
     */
    public static SimpleTest simpleTest(ExtensionContext context)
    {
        SimpleTest perTest = context.getStore(NAMESPACE).get(RUN_KEY, SimpleTest.class);
        return perTest != null ? perTest : shared(context);
    }

    private static SimpleTest shared(ExtensionContext context)
    {   return context.getRoot()
                      .getStore(NAMESPACE)
                      .getOrComputeIfAbsent(SHARED_KEY, k -> SimpleTest.withDefaults(), SimpleTest.class);
    }

    private static String label(ExtensionContext context)
    {   return context.getRequiredTestClass().getSimpleName() + "." + context.getDisplayName();
    }
}

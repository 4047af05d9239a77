package com.fhi.libraries.simpletest.junit;

import com.fhi.libraries.simpletest.context.TestCase;

import lombok.Value;

/**
 * A JUnit test method, as registered in the run context.
 */
@Value
public class JUnitTestCase implements TestCase
{
    Class<?> testClass;

    String label;

    /** The test instance, or {@code null} for class level callbacks. */
    Object testInstance;
}

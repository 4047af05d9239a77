package com.fhi.libraries.simpletest.context;

/**
 * The test case currently being run, as seen by mock objects and other collaborators.
 */
public interface TestCase
{
    /**
     * Human readable name of the test, used in reports.
     */
    String getLabel();
}

package com.fhi.libraries.simpletest.reporter;

/**
 * Sink for test events. The framework core never looks inside a reporter; it only stores the
 * active one and hands out preferred instances.
 */
public interface Reporter
{
    void report(TestEvent event);
}

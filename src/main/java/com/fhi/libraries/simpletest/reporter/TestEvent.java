package com.fhi.libraries.simpletest.reporter;

import lombok.Value;

/**
 * Outcome of a single test, as sent to a {@link Reporter}.
 */
@Value
public class TestEvent
{
    public enum Kind
    {
        PASS,
        FAIL,
        ERROR,
        SKIP
    }

    Kind kind;

    String testLabel;

    /** Free text; may be empty but never null. */
    String message;


    public static TestEvent pass(String testLabel)
    {   return new TestEvent(Kind.PASS, testLabel, "");
    }

    public static TestEvent fail(String testLabel, String message)
    {   return new TestEvent(Kind.FAIL, testLabel, message);
    }

    public static TestEvent error(String testLabel, String message)
    {   return new TestEvent(Kind.ERROR, testLabel, message);
    }

    public static TestEvent skip(String testLabel, String reason)
    {   return new TestEvent(Kind.SKIP, testLabel, reason);
    }
}

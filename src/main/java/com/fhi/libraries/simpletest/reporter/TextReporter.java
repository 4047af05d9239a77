package com.fhi.libraries.simpletest.reporter;

import java.io.PrintWriter;

/**
 * Plain text reporter, e.g. {@code FAIL: MyTest.testThing: expected 1 at [com/acme/MyTest.java line 12]}.
 */
public class TextReporter extends AbstractLineReporter
{
    public TextReporter()
    {   super();
    }

    public TextReporter(PrintWriter out)
    {   super(out);
    }

    @Override
    protected String render(TestEvent event)
    {
        String line = event.getKind() + ": " + event.getTestLabel();
        return event.getMessage().isEmpty() ? line : line + ": " + event.getMessage();
    }
}

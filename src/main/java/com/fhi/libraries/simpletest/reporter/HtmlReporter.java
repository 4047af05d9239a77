package com.fhi.libraries.simpletest.reporter;

import java.io.PrintWriter;
import java.util.Locale;

public class HtmlReporter extends AbstractLineReporter
{
    public HtmlReporter()
    {   super();
    }

    public HtmlReporter(PrintWriter out)
    {   super(out);
    }

    @Override
    protected String render(TestEvent event)
    {   return "<p class=\"" + event.getKind().name().toLowerCase(Locale.ROOT) + "\">"
             + escapeMarkup(event.getTestLabel())
             + (event.getMessage().isEmpty() ? "" : ": " + escapeMarkup(event.getMessage()))
             + "</p>";
    }
}

package com.fhi.libraries.simpletest.reporter;

import java.io.PrintWriter;
import java.util.Locale;

public class XmlReporter extends AbstractLineReporter
{
    public XmlReporter()
    {   super();
    }

    public XmlReporter(PrintWriter out)
    {   super(out);
    }

    @Override
    protected String render(TestEvent event)
    {   return "<" + event.getKind().name().toLowerCase(Locale.ROOT)
             + " test=\"" + escapeMarkup(event.getTestLabel()) + "\">"
             + escapeMarkup(event.getMessage())
             + "</" + event.getKind().name().toLowerCase(Locale.ROOT) + ">";
    }
}

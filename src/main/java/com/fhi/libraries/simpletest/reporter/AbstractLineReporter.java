package com.fhi.libraries.simpletest.reporter;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Base for reporters that write one line per event.
 */
public abstract class AbstractLineReporter implements Reporter
{
    private final PrintWriter out;

    protected AbstractLineReporter()
    {   this(new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true));
    }

    protected AbstractLineReporter(PrintWriter out)
    {   this.out = out;
    }

    @Override
    public void report(TestEvent event)
    {   out.println(render(event));
        out.flush();
    }

    protected abstract String render(TestEvent event);


    protected static String escapeMarkup(String text)
    {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray())
        {   switch (c)
            {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                default  -> sb.append(c);
            }
        }
        return sb.toString();
    }
}

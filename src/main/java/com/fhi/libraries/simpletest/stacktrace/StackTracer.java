package com.fhi.libraries.simpletest.stacktrace;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

/**
 * Interrogates a stack trace to recover the failure point.
 *
 * <p>Frames are scanned from the outermost call towards the point of capture. A frame names the called
 * function and the file and line of its call site. Frames called from a file lying directly inside the
 * framework's own directory are skipped; the first remaining frame whose function name starts with one of
 * the configured prefixes is reported as {@code " at [file line N]"}, i.e. the line that made the call.</p>
 *
 * <p>Scanning outermost first finds the highest level call site that looks like an assertion, so a
 * failure raised several user helpers deep is still attributed to the line the test author wrote.
 * Only files sitting directly in the framework directory are skipped: a file in a sub-directory of it
 * (i.e. a sub-package) is treated like user code.</p>
 *
 * <p>Instances are immutable and hold no per-call state.</p>
 */
@Slf4j
public class StackTracer
{
    private final List<String> prefixes;

    /** Slash separated directory of the framework's own sources, e.g. {@code com/fhi/libraries/simpletest}. */
    private final String frameworkDirectory;


    /**
     * @param prefixes           method name prefixes to search for, e.g. {@code assert}
     * @param frameworkDirectory directory whose files never count as the failure point
     */
    public StackTracer(List<String> prefixes, String frameworkDirectory)
    {   this.prefixes = List.copyOf(prefixes);
        this.frameworkDirectory = stripTrailingSlash(frameworkDirectory);
    }


    /**
     * Captures the current call stack and extracts the first matching frame outside the framework.
     *
     * @return snippet of test report with file and line number, or an empty string if no frame matches
     */
    public String traceMethod()
    {   return traceMethod(null);
    }

    /**
     * Extracts the first frame, in outermost-first order, that is not within the framework itself and
     * whose function matches one of the prefixes.
     *
     * @param stack frames ordered outermost first; {@code null} captures the live stack
     * @return snippet of test report with file and line number, or an empty string if no frame matches
     */
    public String traceMethod(List<StackFrame> stack)
    {
        List<StackFrame> frames = stack != null ? stack : captureTrace();

        for (StackFrame frame : frames)
        {
            if (frameLiesWithinFrameworkFolder(frame)) {
                continue;
            }
            if (frameMatchesPrefix(frame)) {
                return " at [" + frame.getFile() + " line " + frame.getLine() + "]";
            }
        }
        return "";
    }

    /**
     * Locates the failure point of a thrown exception, typically an assertion error.
     */
    public String traceFailure(Throwable failure)
    {   return traceMethod(StackFrame.fromThrowable(failure));
    }

    public List<String> getPrefixes()
    {   return prefixes;
    }

    public String getFrameworkDirectory()
    {   return frameworkDirectory;
    }


    /**
     * True if the frame's file sits directly in the framework directory. Sub-directories don't count.
     */
    protected boolean frameLiesWithinFrameworkFolder(StackFrame frame)
    {
        String directory = frame.getDirectory();
        return directory != null && directory.equals(frameworkDirectory);
    }

    /**
     * Tries to determine if the method call is an assert, etc.
     */
    protected boolean frameMatchesPrefix(StackFrame frame)
    {
        String function = frame.getFunction();
        if (function == null) return false;
        for (String prefix : prefixes)
        {   if (function.startsWith(prefix)) return true;
        }
        return false;
    }

    /**
     * Grabs the live call stack, outermost frame first.
     */
    protected List<StackFrame> captureTrace()
    {
        List<StackTraceElement> elements = StackWalker.getInstance()
                .walk(s -> s.map(StackWalker.StackFrame::toStackTraceElement).collect(Collectors.toList()));
        Collections.reverse(elements);
        log.trace("Captured {} stack elements", elements.size());
        return StackFrame.fromElements(elements);
    }


    private static String stripTrailingSlash(String directory)
    {
        if (directory.endsWith("/")) {
            return directory.substring(0, directory.length() - 1);
        }
        return directory;
    }
}

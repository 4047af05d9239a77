package com.fhi.libraries.simpletest.stacktrace;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.Value;

/**
 * One call in a captured call stack: the function that was called, and the source file and line it was
 * called from.
 *
 * <p>A JVM stack element describes the line being executed inside a method. Here {@code file} and
 * {@code line} are those of the caller instead, so a frame for {@code assertEquals} points at the line of
 * the test that called it. Frames built from the JVM carry a slash separated source path made of the
 * caller's package and source file name, e.g. {@code com/acme/UserTest.java}. A package therefore plays
 * the part of a source folder when the {@link StackTracer} decides whether a frame belongs to the
 * framework.</p>
 */
@Value
public class StackFrame
{
    /** Source path of the call site, or {@code null} if the JVM did not record one. */
    String file;

    /** Line of the call site. */
    int line;

    /** Name of the called function. */
    String function;


    public static StackFrame of(String file, int line, String function)
    {   return new StackFrame(file, line, function);
    }

    /**
     * The call of {@code function} made from {@code caller}'s current line.
     */
    public static StackFrame callFrom(StackTraceElement caller, String function)
    {   return new StackFrame(sourcePath(caller.getClassName(), caller.getFileName()),
                              caller.getLineNumber(),
                              function);
    }

    /**
     * Pairs each method with the element that called it.
     *
     * @param elements JVM stack elements, outermost (earliest) first
     * @return calls, outermost first; the outermost element has no known caller and gives no frame
     */
    public static List<StackFrame> fromElements(List<StackTraceElement> elements)
    {
        List<StackFrame> frames = new ArrayList<>(Math.max(elements.size() - 1, 0));
        for (int i = 1; i < elements.size(); i++)
        {   frames.add(callFrom(elements.get(i - 1), elements.get(i).getMethodName()));
        }
        return frames;
    }

    /**
     * Calls leading to a throwable, outermost first.
     */
    public static List<StackFrame> fromThrowable(Throwable throwable)
    {
        List<StackTraceElement> elements = new ArrayList<>(Arrays.asList(throwable.getStackTrace()));
        Collections.reverse(elements);
        return fromElements(elements);
    }

    /**
     * Parent directory of {@link #file}, or {@code null} when the file is unknown or has no directory part.
     */
    public String getDirectory()
    {
        if (file == null) return null;
        int slash = file.lastIndexOf('/');
        return slash < 0 ? null : file.substring(0, slash);
    }


    static String sourcePath(String className, String fileName)
    {
        if (fileName == null) return null;
        int dot = className.lastIndexOf('.');
        if (dot < 0) return fileName;
        return className.substring(0, dot).replace('.', '/') + "/" + fileName;
    }
}

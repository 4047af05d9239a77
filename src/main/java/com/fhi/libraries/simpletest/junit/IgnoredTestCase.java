package com.fhi.libraries.simpletest.junit;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a test class as not runnable, typically an abstract base case that concrete cases extend.
 *
 * <p>With {@code @ExtendWith(SimpleTestExtension.class)} the class is put on the ignore list, and so are its
 * parents. Deliberately not {@code @Inherited}: subclasses of an ignored case still run.</p>
 *
 * <pre>{@code
 *    @IgnoredTestCase
 *    @ExtendWith(SimpleTestExtension.class)
 *    class DatabaseCaseTemplate { ... }
 * }</pre>
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface IgnoredTestCase
{
}

package com.fhi.libraries.simpletest.reflection;

import java.util.Optional;

/**
 * Answers questions about the class hierarchy by class name.
 */
@FunctionalInterface
public interface ClassHierarchy
{
    /**
     * @return the name of the direct parent class, or empty when there is none worth reporting
     */
    Optional<String> getParent(String className);
}

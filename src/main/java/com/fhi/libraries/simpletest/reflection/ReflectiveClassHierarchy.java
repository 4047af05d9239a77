package com.fhi.libraries.simpletest.reflection;

import java.util.Optional;

import org.springframework.util.ClassUtils;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link ClassHierarchy} backed by the class loader. Classes are looked up without being initialised.
 * Unknown classes, interfaces and direct children of {@code Object} have no parent.
 */
@Slf4j
public class ReflectiveClassHierarchy implements ClassHierarchy
{
    private final ClassLoader classLoader;

    public ReflectiveClassHierarchy()
    {   this(ClassUtils.getDefaultClassLoader());
    }

    public ReflectiveClassHierarchy(ClassLoader classLoader)
    {   this.classLoader = classLoader;
    }

    @Override
    public Optional<String> getParent(String className)
    {
        if (!ClassUtils.isPresent(className, classLoader)) {
            log.debug("Class {} not found, no parent", className);
            return Optional.empty();
        }
        Class<?> parent = ClassUtils.resolveClassName(className, classLoader).getSuperclass();
        if (parent == null || parent == Object.class) {
            return Optional.empty();
        }
        return Optional.of(parent.getName());
    }
}

package com.fhi.libraries.simpletest.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.StringUtils;

import com.fhi.libraries.simpletest.SimpleTest;
import com.fhi.libraries.simpletest.context.RunContext;
import com.fhi.libraries.simpletest.reflection.ClassHierarchy;
import com.fhi.libraries.simpletest.reflection.ReflectiveClassHierarchy;
import com.fhi.libraries.simpletest.registry.TestRegistry;
import com.fhi.libraries.simpletest.stacktrace.StackTracer;

import lombok.extern.slf4j.Slf4j;

/**
 * Composition root for Spring applications: builds the registry, run context, class hierarchy, stack tracer
 * and {@link SimpleTest} facade once, and exposes them as beans.
 *
 * <p>Every bean backs off if the application defines its own.</p>
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(SimpleTestProperties.class)
public class SimpleTestConfiguration
{
    @Bean
    @ConditionalOnMissingBean
    @SuppressWarnings("deprecation")
    public TestRegistry testRegistry(SimpleTestProperties properties)
    {
        TestRegistry registry = TestRegistry.withDefaults();

        SimpleTestProperties.Proxy proxy = properties.getProxy();
        if (StringUtils.hasText(proxy.getUrl())) {
            registry.useProxy(proxy.getUrl(), proxy.getUsername(), proxy.getPassword());
        }
        if (!properties.getParsers().isEmpty()) {
            registry.setParsers(properties.getParsers());
        }
        registry.setMockBaseClass(properties.getMockBaseClass());
        properties.getIgnore().forEach(registry::ignore);

        log.info("Test registry ready: {} ignored test cases, proxy {}",
                 properties.getIgnore().size(), StringUtils.hasText(proxy.getUrl()) ? proxy.getUrl() : "none");
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public RunContext runContext()
    {   return new RunContext();
    }

    @Bean
    @ConditionalOnMissingBean
    public ClassHierarchy classHierarchy()
    {   return new ReflectiveClassHierarchy();
    }

    @Bean
    @ConditionalOnMissingBean
    public StackTracer stackTracer(SimpleTestProperties properties)
    {   return new StackTracer(properties.getTrace().getPrefixes(), properties.getTrace().getFrameworkDirectory());
    }

    @Bean
    @ConditionalOnMissingBean
    public SimpleTest simpleTest(TestRegistry registry, RunContext runContext,
                                 ClassHierarchy classHierarchy, StackTracer stackTracer)
    {   return new SimpleTest(registry, runContext, classHierarchy, stackTracer);
    }
}

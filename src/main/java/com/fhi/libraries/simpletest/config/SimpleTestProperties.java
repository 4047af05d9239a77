package com.fhi.libraries.simpletest.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.fhi.libraries.simpletest.SimpleTest;
import com.fhi.libraries.simpletest.registry.TestRegistry;

import lombok.Getter;
import lombok.Setter;

/**
 * Externalised settings applied on top of the registry defaults.
 *
 * <pre>
 * simpletest:
 *   proxy:
 *     url: http://proxy.local:3128
 *     username: tester
 *     password: secret
 *   parsers: [native, tidy]
 *   ignore:
 *     - com.acme.AbstractDatabaseCase
 *   trace:
 *     prefixes: [assert, expect, fail]
 *     framework-directory: com/fhi/libraries/simpletest
 *   diagnostics:
 *     enabled: true
 * </pre>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "simpletest")
public class SimpleTestProperties
{
    private Proxy proxy = new Proxy();

    /** Parsers to try in order. Empty means let the framework choose. */
    private List<String> parsers = new ArrayList<>();

    private String mockBaseClass = TestRegistry.DEFAULT_MOCK_BASE_CLASS;

    /** Test case class names to put on the ignore list at startup. */
    private List<String> ignore = new ArrayList<>();

    private Trace trace = new Trace();

    private Diagnostics diagnostics = new Diagnostics();


    @Getter
    @Setter
    public static class Proxy
    {
        private String url;
        private String username;
        private String password;
    }

    @Getter
    @Setter
    public static class Trace
    {
        private List<String> prefixes = new ArrayList<>(SimpleTest.DEFAULT_TRACE_PREFIXES);
        private String frameworkDirectory = SimpleTest.FRAMEWORK_DIRECTORY;
    }

    @Getter
    @Setter
    public static class Diagnostics
    {
        private boolean enabled = false;
    }
}

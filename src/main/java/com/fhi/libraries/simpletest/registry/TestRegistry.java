package com.fhi.libraries.simpletest.registry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import com.fhi.libraries.simpletest.reporter.HtmlReporter;
import com.fhi.libraries.simpletest.reporter.Reporter;
import com.fhi.libraries.simpletest.reporter.TextReporter;
import com.fhi.libraries.simpletest.reporter.XmlReporter;

import lombok.extern.slf4j.Slf4j;


/**
 * Cross-run configuration of the test framework: the ignore list, proxy settings, the pool of preferred
 * objects, the HTML parser preference and the (deprecated) mock base class.
 *
 * <p>One instance is meant to be created at startup, initialised with {@link #initDefaults()} and handed to
 * everything that needs it. Tests can simply build their own.</p>
 *
 * <h3>Defaults</h3>
 * <pre>
 *   parsers           absent (framework picks)
 *   mockBaseClass     "SimpleMock"
 *   ignoreList        empty
 *   proxy             absent
 *   preferredPool     HtmlReporter, TextReporter, XmlReporter (in that order)
 * </pre>
 *
 * <h3>Thread-safety</h3>
 * <p>The ignore list, the pool and the options may be read and changed from concurrent tests: the ignore list
 * is a concurrent set, the pool swaps immutable snapshots and the proxy triple is replaced as a whole.
 * {@link #initDefaults()} is the exception. It is meant for startup, before tests run: each field is reset
 * atomically, but other threads may see some fields already reset and others not yet.</p>
 */
@Slf4j
public class TestRegistry
{
    public static final String DEFAULT_MOCK_BASE_CLASS = "SimpleMock";

    private final Set<String> ignoreList = ConcurrentHashMap.newKeySet();

    private final PreferredPool preferredPool = new PreferredPool();

    private volatile ProxySettings proxy = ProxySettings.NONE;

    private volatile List<String> parsers;

    private volatile String mockBaseClass;


    /**
     * Creates a registry with the default values already applied.
     */
    public static TestRegistry withDefaults()
    {   return new TestRegistry().initDefaults();
    }

    /**
     * Resets every field to its default value. Call at startup; concurrent callers are serialised, but the
     * reset as a whole is not atomic for concurrent readers.
     *
     * @return this registry
     */
    public synchronized TestRegistry initDefaults()
    {   log.debug("Applying registry defaults");
        parsers = null;
        mockBaseClass = DEFAULT_MOCK_BASE_CLASS;
        ignoreList.clear();
        proxy = ProxySettings.NONE;
        preferredPool.reset(List.of(
                new PreferredPool.Entry(new HtmlReporter(), Set.of(HtmlReporter.class, Reporter.class)),
                new PreferredPool.Entry(new TextReporter(), Set.of(TextReporter.class, Reporter.class)),
                new PreferredPool.Entry(new XmlReporter(), Set.of(XmlReporter.class, Reporter.class))));
        return this;
    }


    // =====================================================================
    // Ignore list
    // =====================================================================

    /**
     * Sets the name of a test case to ignore, usually because the class is an abstract case
     * that should not be run.
     */
    public void ignore(String className)
    {   if (ignoreList.add(normalize(className))) {
            log.debug("Ignoring test case {}", className);
        }
    }

    /**
     * Case insensitive test of the ignore list.
     */
    public boolean isIgnored(String className)
    {   return ignoreList.contains(normalize(className));
    }

    /**
     * Lower-cased names on the ignore list.
     */
    public Set<String> getIgnoreList()
    {   return Set.copyOf(ignoreList);
    }


    // =====================================================================
    // Preferred objects
    // =====================================================================

    /**
     * Puts an object into the pool of preferred objects.
     *
     * @param object       the preferred object
     * @param capabilities tags the object satisfies; when none are given the object's own class is used
     */
    public void prefer(Object object, Class<?>... capabilities)
    {
        Set<Class<?>> tags = new LinkedHashSet<>(Arrays.asList(capabilities));
        if (tags.isEmpty()) {
            tags.add(object.getClass());
        }
        log.debug("Preferring {} for {}", object.getClass().getSimpleName(), tags);
        preferredPool.add(object, tags);
    }

    /**
     * Retrieves the most recently preferred object declaring the given capability.
     */
    public <T> Optional<T> preferred(Class<T> capability)
    {   return preferredPool.findAny(List.<Class<?>>of(capability)).map(capability::cast);
    }

    /**
     * Retrieves the most recently preferred object declaring any of the given capabilities.
     */
    public Optional<Object> preferredAny(Class<?>... capabilities)
    {   return preferredPool.findAny(Arrays.asList(capabilities));
    }

    public PreferredPool getPreferredPool()
    {   return preferredPool;
    }


    // =====================================================================
    // Proxy
    // =====================================================================

    /**
     * Sets the proxy to use on all requests. Pass a {@code null} URL to disable.
     */
    public void useProxy(String url, String username, String password)
    {   proxy = new ProxySettings(url, username, password);
    }

    public ProxySettings getProxy()
    {   return proxy;
    }

    public String getDefaultProxy()
    {   return proxy.getUrl();
    }

    public String getDefaultProxyUsername()
    {   return proxy.getUsername();
    }

    public String getDefaultProxyPassword()
    {   return proxy.getPassword();
    }


    // =====================================================================
    // Parsers & mock base class
    // =====================================================================

    /**
     * List of parsers to try in order, or {@code null} to let the framework choose.
     */
    public List<String> getParsers()
    {   return parsers;
    }

    public void setParsers(List<String> parsers)
    {   this.parsers = parsers == null ? null : List.copyOf(parsers);
    }

    /**
     * @deprecated kept for older mock generators only
     */
    @Deprecated
    public String getMockBaseClass()
    {   return mockBaseClass;
    }

    /**
     * @deprecated kept for older mock generators only
     */
    @Deprecated
    public void setMockBaseClass(String mockBaseClass)
    {   this.mockBaseClass = mockBaseClass;
    }


    /**
     * Read-only view of the current state, for diagnostics. The proxy password is masked.
     */
    public Map<String, Object> snapshot()
    {
        ProxySettings current = proxy;
        Map<String, Object> proxyView = new LinkedHashMap<>();
        proxyView.put("url", current.getUrl());
        proxyView.put("username", current.getUsername());
        proxyView.put("password", current.getPassword() == null ? null : "****");

        List<String> preferred = new ArrayList<>();
        for (PreferredPool.Entry entry : preferredPool.entries())
        {   preferred.add(entry.getObject().getClass().getName());
        }

        Map<String, Object> view = new LinkedHashMap<>();
        view.put("parsers", parsers);
        view.put("mockBaseClass", mockBaseClass);
        view.put("ignoreList", new TreeSet<>(ignoreList));
        view.put("proxy", proxyView);
        view.put("preferred", preferred);
        return view;
    }


    private static String normalize(String className)
    {   return className.toLowerCase(Locale.ROOT);
    }
}

package com.fhi.libraries.simpletest.registry;

import lombok.Value;

/**
 * Default proxy used on all requests when testing from behind a firewall.
 * Any field may be {@code null}; a {@code null} URL means no proxy.
 */
@Value
public class ProxySettings
{
    public static final ProxySettings NONE = new ProxySettings(null, null, null);

    String url;

    String username;

    String password;
}

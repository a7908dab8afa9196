package com.credential.dedupe.provider;

import com.credential.dedupe.provider.plugins.ApplePasswordsPlugin;
import com.credential.dedupe.provider.plugins.BitwardenPlugin;
import com.credential.dedupe.provider.plugins.ChromiumBrowserPlugin;
import com.credential.dedupe.provider.plugins.DashlanePlugin;
import com.credential.dedupe.provider.plugins.FirefoxPlugin;
import com.credential.dedupe.provider.plugins.KasperskyPlugin;
import com.credential.dedupe.provider.plugins.LastPassPlugin;
import com.credential.dedupe.provider.plugins.NordPassPlugin;
import com.credential.dedupe.provider.plugins.ProtonPassPlugin;
import com.credential.dedupe.provider.plugins.RoboFormPlugin;

import java.util.List;

/**
 * The provider plugins shipped with the library.
 */
public final class BuiltInProviders {

    private BuiltInProviders() {
        // Utility class
    }

    /**
     * Creates a new registry holding every built-in plugin.
     * Each call returns an independent registry.
     */
    public static ProviderRegistry createDefaultRegistry() {
        return new ProviderRegistry(createPlugins());
    }

    /**
     * Fresh instances of the built-in plugins, Proton Pass first.
     */
    public static List<ProviderPlugin> createPlugins() {
        return List.of(
                new ProtonPassPlugin(),
                new LastPassPlugin(),
                new BitwardenPlugin(),
                new DashlanePlugin(),
                new RoboFormPlugin(),
                new NordPassPlugin(),
                new ApplePasswordsPlugin(),
                new KasperskyPlugin(),
                new FirefoxPlugin(),
                new ChromiumBrowserPlugin()
        );
    }
}

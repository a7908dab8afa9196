package com.credential.dedupe.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Holds the provider plugins available to one application.
 *
 * <p>A registry is an ordinary value: construct it once at startup, register plugins,
 * then pass it to the detector, importer and exporter. Consumers {@link #freeze() freeze}
 * the registry when they take it, after which registration fails and lookups may be
 * shared between threads without locking. Registration itself is not synchronized and
 * belongs to startup.</p>
 */
public class ProviderRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderPlugin> plugins = new LinkedHashMap<>();
    private volatile boolean frozen;

    public ProviderRegistry() {
    }

    public ProviderRegistry(List<? extends ProviderPlugin> initial) {
        initial.forEach(this::register);
    }

    /**
     * Registers a plugin under its provider id.
     *
     * @throws DuplicateProviderIdException if the id is already registered
     * @throws IllegalStateException if the registry is frozen
     */
    public ProviderRegistry register(ProviderPlugin plugin) {
        Objects.requireNonNull(plugin, "plugin is required");
        if (frozen) {
            throw new IllegalStateException("Registry is frozen; cannot register " + plugin.getProviderId());
        }
        String providerId = Objects.requireNonNull(plugin.getProviderId(), "providerId is required");
        if (plugins.containsKey(providerId)) {
            throw new DuplicateProviderIdException(providerId);
        }
        plugins.put(providerId, plugin);
        log.debug("provider.registered providerId={}", providerId);
        return this;
    }

    /**
     * Ends registration. Idempotent.
     */
    public ProviderRegistry freeze() {
        if (!frozen) {
            frozen = true;
            log.debug("provider.registry_frozen providers={}", plugins.size());
        }
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Returns the plugin registered under the id.
     *
     * @throws UnknownProviderException if no plugin has that id
     */
    public ProviderPlugin get(String providerId) {
        ProviderPlugin plugin = providerId != null ? plugins.get(providerId) : null;
        if (plugin == null) {
            throw new UnknownProviderException(providerId);
        }
        return plugin;
    }

    public boolean contains(String providerId) {
        return plugins.containsKey(providerId);
    }

    /**
     * Provider ids in registration order.
     */
    public List<String> list() {
        return Collections.unmodifiableList(new ArrayList<>(plugins.keySet()));
    }

    /**
     * Plugins in registration order.
     */
    public List<ProviderPlugin> plugins() {
        return Collections.unmodifiableList(new ArrayList<>(plugins.values()));
    }

    public int size() {
        return plugins.size();
    }
}

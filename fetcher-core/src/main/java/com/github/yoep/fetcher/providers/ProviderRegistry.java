package com.github.yoep.fetcher.providers;

import com.github.yoep.fetcher.adapter.ProviderException;
import com.github.yoep.fetcher.adapter.SubtitleProviderFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * The fixed registry of known subtitle providers, indexed by provider name.
 */
@Slf4j
public class ProviderRegistry {
    private final Map<String, SubtitleProviderFactory> factories = new LinkedHashMap<>();

    public ProviderRegistry(List<SubtitleProviderFactory> factories) {
        Objects.requireNonNull(factories, "factories cannot be null");
        for (var factory : factories) {
            if (this.factories.putIfAbsent(factory.getName(), factory) != null) {
                throw new ProviderException(factory.getName(), "Subtitle provider " + factory.getName() + " has been registered twice");
            }

            log.debug("Registered subtitle provider {}", factory.getName());
        }
    }

    /**
     * Get the factory of the given provider.
     *
     * @param name The name of the provider.
     * @return Returns the provider factory.
     * @throws ProviderException Is thrown when the provider is unknown.
     */
    public SubtitleProviderFactory getFactory(String name) {
        return Optional.ofNullable(name)
                .map(factories::get)
                .orElseThrow(() -> new ProviderException(name));
    }

    public boolean contains(String name) {
        return name != null && factories.containsKey(name);
    }

    /**
     * Get the names of all registered providers, in registration order.
     *
     * @return Returns the provider names.
     */
    public List<String> getNames() {
        return List.copyOf(factories.keySet());
    }

    /**
     * Get the names of the registered providers which are API based.
     * These are the providers which are used when no provider preference is configured.
     *
     * @return Returns the API based provider names.
     */
    public List<String> getApiBasedNames() {
        return factories.values().stream()
                .filter(SubtitleProviderFactory::isApiBased)
                .map(SubtitleProviderFactory::getName)
                .toList();
    }
}

package io.convotest.core.provider;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ProviderRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, LlmProvider> providers = new ConcurrentHashMap<>();

    public static ProviderRegistry of(LlmProvider... providers) {
        ProviderRegistry registry = new ProviderRegistry();
        for (LlmProvider provider : providers) {
            registry.register(provider);
        }
        return registry;
    }

    public ProviderRegistry register(LlmProvider provider) {
        Objects.requireNonNull(provider, "provider must not be null");
        LlmProvider previous = providers.put(normalize(provider.name()), provider);
        if (previous != null) {
            LOG.debug("Replaced provider {}", provider.name());
        }
        return this;
    }

    public Optional<LlmProvider> find(String name) {
        return Optional.ofNullable(providers.get(normalize(name)));
    }

    public LlmProvider resolve(String name) {
        return find(name).orElseGet(() -> {
            LOG.debug("Provider {} is not registered", name);
            return new DisabledProvider(name == null ? "" : name, "provider is not registered");
        });
    }

    public Set<String> names() {
        return new TreeSet<>(providers.keySet());
    }

    static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    }
}

package com.staybot.fetch;

import com.staybot.config.Config;
import com.staybot.config.ConfigException;
import com.staybot.fetch.http.HttpClientEx;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fetchers keyed by source name, in registration order.
 */
public final class FetcherRegistry {
    private final Map<String, Fetcher> fetchers = new LinkedHashMap<>();

    public FetcherRegistry register(Fetcher fetcher) {
        String name = fetcher.name().trim().toLowerCase(Locale.ROOT);
        if (fetchers.containsKey(name)) {
            throw new IllegalArgumentException("fetcher already registered: " + name);
        }
        fetchers.put(name, fetcher);
        return this;
    }

    public Fetcher get(String name) {
        Fetcher fetcher = fetchers.get(name == null ? "" : name.trim().toLowerCase(Locale.ROOT));
        if (fetcher == null) {
            throw new IllegalArgumentException("unsupported source '" + name + "', known: " + fetchers.keySet());
        }
        return fetcher;
    }

    public List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(fetchers.keySet()));
    }

    public List<Fetcher> all() {
        return Collections.unmodifiableList(new ArrayList<>(fetchers.values()));
    }

    /**
     * Registers the built-in fetchers named by {@code sources}.
     */
    public static FetcherRegistry fromConfig(Config config, HttpClientEx http) {
        FetcherRegistry registry = new FetcherRegistry();
        for (String source : config.getList("sources")) {
            String name = source.toLowerCase(Locale.ROOT);
            if (BookingFetcher.NAME.equals(name)) {
                registry.register(new BookingFetcher(config, http));
            } else {
                throw new ConfigException("unsupported source in 'sources': " + source
                        + " (supported: " + BookingFetcher.NAME + ")");
            }
        }
        if (registry.fetchers.isEmpty()) {
            throw new ConfigException("'sources' must name at least one source");
        }
        return registry;
    }
}

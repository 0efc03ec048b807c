package dev.dimitra.reviewbot.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry handing out one shared client per (consumer name, backend kind, temperature).
 * <p>
 * Creation goes through {@link ConcurrentMap#computeIfAbsent}, so two reviewers asking for the same key at the
 * same moment get the same instance and the factory runs once. Entries live until {@link #clear()}; expired
 * tokens are the client's concern.
 */
public class LlmClientCache {
    private static final Logger log = LoggerFactory.getLogger(LlmClientCache.class);

    public record Key(String name, BackendKind kind, double temperature) {
        public Key {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public String toString() {
            return name + "_" + kind.name().toLowerCase() + "_" + temperature;
        }
    }

    private final ConcurrentMap<Key, LlmClient> clients = new ConcurrentHashMap<>();
    private final LlmClientFactory factory;

    public LlmClientCache(LlmClientFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public LlmClient get(String name, BackendKind kind, double temperature) {
        Key key = new Key(name, kind, temperature);
        LlmClient existing = clients.get(key);
        if (existing != null) {
            log.debug("Using cached LLM client {}", key);
            return existing;
        }
        return clients.computeIfAbsent(key, k -> {
            log.info("Creating new LLM client {}", k);
            return factory.create(k.kind(), k.temperature());
        });
    }

    public void clear() {
        clients.clear();
        log.info("LLM client cache cleared");
    }

    public int size() {
        return clients.size();
    }

    public List<Key> keys() {
        return List.copyOf(clients.keySet());
    }
}

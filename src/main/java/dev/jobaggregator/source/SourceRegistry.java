package dev.jobaggregator.source;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Adapters by source id, iterated in priority order.
 */
@Slf4j
@Component
public class SourceRegistry {

    private final Map<String, SourceAdapter> adapters = new LinkedHashMap<>();

    public SourceRegistry(List<SourceAdapter> sourceAdapters) {
        sourceAdapters.stream()
                .sorted(Comparator.comparingInt(SourceAdapter::getPriority).thenComparing(SourceAdapter::getSourceId))
                .forEach(adapter -> {
                    SourceAdapter previous = adapters.put(adapter.getSourceId(), adapter);
                    if (previous != null) {
                        throw new IllegalStateException("Duplicate source id: " + adapter.getSourceId());
                    }
                });
        log.info("Registered sources: {}", adapters.keySet());
    }

    public Optional<SourceAdapter> find(String sourceId) {
        return Optional.ofNullable(adapters.get(sourceId));
    }

    public boolean contains(String sourceId) {
        return adapters.containsKey(sourceId);
    }

    public Set<String> sourceIds() {
        return adapters.keySet();
    }

    public Collection<SourceAdapter> all() {
        return adapters.values();
    }

    public List<SourceAdapter> enabled() {
        return adapters.values().stream().filter(SourceAdapter::isEnabled).toList();
    }
}

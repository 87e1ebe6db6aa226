package id.my.agungdh.metricsdashboard.service;

import id.my.agungdh.metricsdashboard.DTO.metrics.MetricsSnapshot;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Satu snapshot per source (URL atau {@link #IMPORTED}). Refresh = replace atomik, tidak ada merge/diff.
 */
@Component
public class MetricsCache {

    public static final String IMPORTED = "imported";

    private final Map<String, MetricsSnapshot> bySource = new ConcurrentHashMap<>();
    private final AtomicReference<String> currentSource = new AtomicReference<>();

    public void put(MetricsSnapshot snapshot) {
        bySource.put(snapshot.source(), snapshot);
    }

    public Optional<MetricsSnapshot> get(String source) {
        return Optional.ofNullable(bySource.get(source));
    }

    public void select(String source) {
        currentSource.set(source);
    }

    public Optional<String> currentSource() {
        return Optional.ofNullable(currentSource.get());
    }

    public Optional<MetricsSnapshot> current() {
        return currentSource().flatMap(this::get);
    }
}

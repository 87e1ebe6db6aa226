package id.my.agungdh.metricsdashboard.service;

import id.my.agungdh.metricsdashboard.DTO.metrics.MetricsSnapshot;
import id.my.agungdh.metricsdashboard.DTO.metrics.ParsedMetrics;
import id.my.agungdh.metricsdashboard.client.MetricsEndpointClient;
import id.my.agungdh.metricsdashboard.parser.PrometheusTextParser;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Fetch/import -> parse -> cache. Setiap refresh menghasilkan snapshot baru yang menggantikan yang lama.
 */
@Service
@RequiredArgsConstructor
public class MetricsService {
    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);

    private final MetricsEndpointClient client;
    private final PrometheusTextParser parser;
    private final MetricsCache cache;

    /** Pilih URL sebagai source aktif lalu langsung fetch. */
    public MetricsSnapshot load(String url) {
        cache.select(url);
        log.info("Metrics source set to {}", url);
        return fetchAndCache(url);
    }

    public MetricsSnapshot refresh() {
        String source = cache.currentSource()
                .orElseThrow(() -> new NoMetricsSourceException("No URL provided"));
        if (MetricsCache.IMPORTED.equals(source)) {
            // file import tidak bisa di-fetch ulang, kembalikan yang sudah ada
            return cache.get(source).orElseGet(() -> MetricsSnapshot.empty(source));
        }
        return fetchAndCache(source);
    }

    public MetricsSnapshot importText(String content) {
        ParsedMetrics parsed = parser.parse(content);
        MetricsSnapshot snapshot = new MetricsSnapshot(MetricsCache.IMPORTED, Instant.now(), content, parsed);
        cache.put(snapshot);
        cache.select(MetricsCache.IMPORTED);
        log.info("Imported metrics file ({} samples)", parsed.size());
        return snapshot;
    }

    public MetricsSnapshot importBytes(byte[] content) {
        return importText(parser.decode(content));
    }

    public Optional<MetricsSnapshot> current() {
        return cache.current();
    }

    public Optional<String> currentSource() {
        return cache.currentSource();
    }

    private MetricsSnapshot fetchAndCache(String url) {
        String text = parser.decode(client.fetch(url));
        ParsedMetrics parsed = parser.parse(text);
        MetricsSnapshot snapshot = new MetricsSnapshot(url, Instant.now(), text, parsed);
        cache.put(snapshot);
        log.info("Fetched {} samples from {}", parsed.size(), url);
        return snapshot;
    }
}

package id.my.agungdh.metricsdashboard.DTO.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Hasil satu kali fetch/import: teks mentah + hasil parse. Diganti utuh saat refresh.
 */
public record MetricsSnapshot(
        String source,
        Instant fetchedAt,
        @JsonIgnore String rawText,
        ParsedMetrics metrics
) {
    public static MetricsSnapshot empty(String source) {
        return new MetricsSnapshot(source, Instant.now(), "", ParsedMetrics.empty());
    }
}

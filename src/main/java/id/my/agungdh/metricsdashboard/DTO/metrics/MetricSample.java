package id.my.agungdh.metricsdashboard.DTO.metrics;

import java.util.Map;
import java.util.Objects;

/**
 * Satu data point hasil parse. {@code help} dan {@code type} null kalau family-nya tidak punya metadata.
 * {@code rawType} adalah token TYPE apa adanya, jadi token yang tidak dikenali (mis. {@code stateset}) tetap terbawa.
 */
public record MetricSample(
        String name,
        double value,
        Map<String, String> labels,
        String help,
        MetricType type,
        String rawType
) {
    public MetricSample {
        Objects.requireNonNull(name, "name");
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public String label(String key) {
        return labels.get(key);
    }

    public String labelOrDefault(String key, String fallback) {
        return labels.getOrDefault(key, fallback);
    }
}

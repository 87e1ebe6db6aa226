package id.my.agungdh.metricsdashboard.parser;

import id.my.agungdh.metricsdashboard.DTO.metrics.MetricGroup;
import id.my.agungdh.metricsdashboard.DTO.metrics.MetricSample;
import id.my.agungdh.metricsdashboard.DTO.metrics.ParsedMetrics;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Akumulator per-invocation: append-only per group, urutan = urutan ketemu di teks.
 * Tidak ada sort/dedup di sini.
 */
public final class ParsedMetricsAssembler {

    private final Map<MetricGroup, List<MetricSample>> groups = new EnumMap<>(MetricGroup.class);

    public ParsedMetricsAssembler() {
        for (MetricGroup g : MetricGroup.values()) groups.put(g, new ArrayList<>());
    }

    public void append(MetricClassifier.Classified classified) {
        groups.get(classified.group()).add(classified.sample());
    }

    public ParsedMetrics build() {
        return new ParsedMetrics(
                groups.get(MetricGroup.PROCESS),
                groups.get(MetricGroup.NODE),
                groups.get(MetricGroup.HTTP),
                groups.get(MetricGroup.CUSTOM)
        );
    }
}

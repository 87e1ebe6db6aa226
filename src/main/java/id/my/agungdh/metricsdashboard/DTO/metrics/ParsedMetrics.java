package id.my.agungdh.metricsdashboard.DTO.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

public record ParsedMetrics(
        List<MetricSample> processMetrics,
        List<MetricSample> nodeMetrics,
        List<MetricSample> httpMetrics,
        List<MetricSample> customMetrics
) {
    private static final ParsedMetrics EMPTY = new ParsedMetrics(List.of(), List.of(), List.of(), List.of());

    public ParsedMetrics {
        processMetrics = freeze(processMetrics);
        nodeMetrics = freeze(nodeMetrics);
        httpMetrics = freeze(httpMetrics);
        customMetrics = freeze(customMetrics);
    }

    public static ParsedMetrics empty() {
        return EMPTY;
    }

    public List<MetricSample> group(MetricGroup group) {
        return switch (group) {
            case PROCESS -> processMetrics;
            case NODE -> nodeMetrics;
            case HTTP -> httpMetrics;
            case CUSTOM -> customMetrics;
        };
    }

    /** Semua sample, urut per group (process, node, http, custom). */
    public List<MetricSample> all() {
        List<MetricSample> out = new ArrayList<>(size());
        for (MetricGroup g : MetricGroup.values()) out.addAll(group(g));
        return out;
    }

    public int size() {
        return processMetrics.size() + nodeMetrics.size() + httpMetrics.size() + customMetrics.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return size() == 0;
    }

    private static List<MetricSample> freeze(List<MetricSample> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}

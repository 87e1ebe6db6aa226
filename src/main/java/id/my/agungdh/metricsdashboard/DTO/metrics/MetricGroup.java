package id.my.agungdh.metricsdashboard.DTO.metrics;

/**
 * Empat kelompok output. Urutan enum = urutan prioritas prefix.
 */
public enum MetricGroup {
    PROCESS("process_"),
    NODE("nodejs_"),
    HTTP("http_"),
    CUSTOM(null);

    private final String prefix;

    MetricGroup(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    /** Prefix pertama yang cocok (case-sensitive, anchored di awal nama); sisanya CUSTOM. */
    public static MetricGroup of(String metricName) {
        for (MetricGroup g : values()) {
            if (g.prefix != null && metricName.startsWith(g.prefix)) return g;
        }
        return CUSTOM;
    }
}

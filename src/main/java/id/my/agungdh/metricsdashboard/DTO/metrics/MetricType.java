package id.my.agungdh.metricsdashboard.DTO.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Tipe metric family dari baris {@code # TYPE}.
 * UNKNOWN dipakai kalau token tidak dikenali (token aslinya disimpan di {@link MetricFamilyMetadata#rawType()}).
 */
public enum MetricType {
    COUNTER,
    GAUGE,
    HISTOGRAM,
    SUMMARY,
    UNTYPED,
    UNKNOWN;

    public static MetricType fromToken(String token) {
        if (token == null) return UNKNOWN;
        return switch (token) {
            case "counter" -> COUNTER;
            case "gauge" -> GAUGE;
            case "histogram" -> HISTOGRAM;
            case "summary" -> SUMMARY;
            case "untyped" -> UNTYPED;
            default -> UNKNOWN;
        };
    }

    /** Token lowercase seperti di exposition text; ini juga bentuk JSON-nya. */
    @JsonValue
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package id.my.agungdh.metricsdashboard.parser;

/**
 * Input sama sekali tidak bisa diperlakukan sebagai teks (null, bukan UTF-8 valid).
 * Satu-satunya error yang keluar dari {@link PrometheusTextParser}.
 */
public class MetricsParseException extends RuntimeException {
    public MetricsParseException(String message) {
        super(message);
    }

    public MetricsParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

package id.my.agungdh.metricsdashboard.service;

/**
 * Refresh diminta padahal belum ada source (URL atau import) yang dipilih.
 */
public class NoMetricsSourceException extends RuntimeException {

    public NoMetricsSourceException(String message) {
        super(message);
    }
}

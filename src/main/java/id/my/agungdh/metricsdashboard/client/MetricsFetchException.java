package id.my.agungdh.metricsdashboard.client;

/**
 * Gagal mengambil teks metrics (HTTP non-2xx atau error I/O). Parser tidak pernah dipanggil.
 */
public class MetricsFetchException extends RuntimeException {

    private final Integer statusCode;

    public MetricsFetchException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** Status HTTP upstream; null kalau gagal sebelum ada response. */
    public Integer getStatusCode() {
        return statusCode;
    }
}

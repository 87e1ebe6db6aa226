package id.my.agungdh.metricsdashboard.parser;

/**
 * Satu baris tidak sesuai grammar. Hanya dipakai di dalam parser: baris dibuang, parse lanjut.
 */
public class MalformedLineException extends RuntimeException {
    public MalformedLineException(String message) {
        super(message);
    }

    public MalformedLineException(String message, Throwable cause) {
        super(message, cause);
    }
}
